package com.ucp.merchant.presentation.discovery;

import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.presentation.discovery.response.DiscoveryProfileResponse;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 설정값으로 디스커버리 문서를 조립한다 (프로세스당 한 번)
 */
final class DiscoveryProfileFactory {

    static final String SHOPPING_SERVICE = "dev.ucp.shopping";
    static final String PAYMENT_CONFIG_SCHEMA = "https://ucp.dev/schemas/payment-handler-config.json";

    static final List<String> CAPABILITIES = List.of(
            "dev.ucp.shopping.checkout",
            "dev.ucp.shopping.order",
            "dev.ucp.shopping.discount",
            "dev.ucp.shopping.fulfillment",
            "dev.ucp.shopping.buyer_consent"
    );

    private DiscoveryProfileFactory() {
        throw new AssertionError("DiscoveryProfileFactory는 인스턴스화할 수 없습니다");
    }

    static DiscoveryProfileResponse build(UcpProperties properties) {
        String version = properties.getVersion();
        UcpProperties.Merchant merchant = properties.getMerchant();
        UcpProperties.Payment payment = properties.getPayment();

        List<DiscoveryProfileResponse.Capability> capabilities = CAPABILITIES.stream()
                .map(name -> new DiscoveryProfileResponse.Capability(name, version))
                .collect(Collectors.toList());

        DiscoveryProfileResponse.PaymentHandler upiHandler = DiscoveryProfileResponse.PaymentHandler.builder()
                .id(payment.getHandlerId())
                .name(payment.getHandlerName())
                .version(version)
                .config(Map.of("vpa", merchant.getVpa(), "merchant_name", merchant.getName()))
                .configSchema(PAYMENT_CONFIG_SCHEMA)
                .instrumentSchemas(List.of())
                .build();

        return DiscoveryProfileResponse.builder()
                .ucp(DiscoveryProfileResponse.Ucp.builder()
                        .version(version)
                        .services(Map.of(SHOPPING_SERVICE, new DiscoveryProfileResponse.Service(
                                version, Map.of("endpoint", merchant.getEndpoint()))))
                        .capabilities(capabilities)
                        .build())
                .payment(new DiscoveryProfileResponse.Payment(List.of(upiHandler)))
                .merchant(DiscoveryProfileResponse.Merchant.builder()
                        .shopId(UUID.randomUUID().toString())
                        .name(merchant.getName())
                        .vpa(merchant.getVpa())
                        .productCategories(List.copyOf(merchant.getProductCategories()))
                        .build())
                .build();
    }
}
