package com.ucp.merchant.presentation.discovery.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * UCP 디스커버리 문서 (/.well-known/ucp)
 */
@Getter
@Builder
@AllArgsConstructor
public class DiscoveryProfileResponse {

    @JsonProperty("ucp")
    private Ucp ucp;

    @JsonProperty("payment")
    private Payment payment;

    @JsonProperty("merchant")
    private Merchant merchant;

    @Getter
    @Builder
    @AllArgsConstructor
    public static class Ucp {
        @JsonProperty("version")
        private String version;

        @JsonProperty("services")
        private Map<String, Service> services;

        @JsonProperty("capabilities")
        private List<Capability> capabilities;
    }

    @Getter
    @AllArgsConstructor
    public static class Service {
        @JsonProperty("version")
        private String version;

        @JsonProperty("rest")
        private Map<String, String> rest;
    }

    @Getter
    @AllArgsConstructor
    public static class Capability {
        @JsonProperty("name")
        private String name;

        @JsonProperty("version")
        private String version;
    }

    @Getter
    @AllArgsConstructor
    public static class Payment {
        @JsonProperty("handlers")
        private List<PaymentHandler> handlers;
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class PaymentHandler {
        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("version")
        private String version;

        @JsonProperty("config")
        private Map<String, String> config;

        @JsonProperty("config_schema")
        private String configSchema;

        @JsonProperty("instrument_schemas")
        private List<String> instrumentSchemas;
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class Merchant {
        @JsonProperty("shop_id")
        private String shopId;

        @JsonProperty("name")
        private String name;

        @JsonProperty("vpa")
        private String vpa;

        @JsonProperty("product_categories")
        private List<String> productCategories;
    }
}
