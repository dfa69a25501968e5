package com.ucp.merchant.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.common.exception.ErrorCategory;
import com.ucp.merchant.common.exception.ErrorCode;
import com.ucp.merchant.presentation.common.UcpHeaders;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * {
 *   "error_code": "DOMAIN_PAYMENT_INVALID_SIGNATURE",
 *   "error_message": "요청 서명이 유효하지 않습니다",
 *   "category": "INVALID_SIGNATURE",
 *   "retryable": false,
 *   "timestamp": "2026-01-11T12:34:56.000Z",
 *   "request_id": "req-abc123"
 * }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {

    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("category")
    private ErrorCategory category;

    @JsonProperty("retryable")
    private boolean retryable;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    public static ErrorResponse of(ErrorCode errorCode, String errorMessage) {
        return ErrorResponse.builder()
                .errorCode(errorCode.getCode())
                .errorMessage(errorMessage)
                .category(errorCode.getCategory())
                .retryable(errorCode.isRetryable())
                .timestamp(Instant.now())
                .requestId(currentRequestId())
                .build();
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    /**
     * 요청의 Request-Id (없으면 생성)
     */
    private static String currentRequestId() {
        String requestId = MDC.get(UcpHeaders.MDC_REQUEST_ID);
        return requestId != null ? requestId : "req-" + UUID.randomUUID().toString().substring(0, 12);
    }
}
