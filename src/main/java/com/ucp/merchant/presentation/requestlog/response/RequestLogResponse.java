package com.ucp.merchant.presentation.requestlog.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.domain.requestlog.RequestLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestLogResponse {

    @JsonProperty("request_id")
    private String requestId;

    private String agent;

    private String method;

    private String path;

    @JsonProperty("checkout_session_id")
    private String checkoutSessionId;

    @JsonProperty("response_status")
    private Integer responseStatus;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static RequestLogResponse from(RequestLog log) {
        return RequestLogResponse.builder()
                .requestId(log.getRequestId())
                .agent(log.getAgent())
                .method(log.getMethod())
                .path(log.getPath())
                .checkoutSessionId(log.getCheckoutSessionId())
                .responseStatus(log.getResponseStatus())
                .createdAt(log.getCreatedAt())
                .build();
    }
}
