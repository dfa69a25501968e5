package com.ucp.merchant.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드, 에러 분류, 재시도 가능 여부 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_PRODUCT_NOT_FOUND, SYSTEM_TRANSIENT_STORE_CONTENTION
 *
 * 재시도 가능 코드:
 * - FULFILLMENT_BLOCKED: 결제 확인 중 재고 경합 (세션은 PENDING 유지)
 * - TRANSIENT_STORE_CONTENTION: 락 대기/데드락 등 저장소 경합
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404, ErrorCategory.NOT_FOUND, false),
    INSUFFICIENT_INVENTORY("DOMAIN_PRODUCT_INSUFFICIENT_INVENTORY", "재고가 부족합니다", 409, ErrorCategory.INSUFFICIENT_INVENTORY, false),
    FULFILLMENT_BLOCKED("DOMAIN_PAYMENT_FULFILLMENT_BLOCKED", "재고 경합으로 주문을 확정하지 못했습니다. 결제 세션은 유지되며 재시도할 수 있습니다", 409, ErrorCategory.INSUFFICIENT_INVENTORY, true),

    // Cart Domain
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상 1000 이하여야 합니다", 400, ErrorCategory.VALIDATION_ERROR, false),
    EMPTY_CART("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400, ErrorCategory.VALIDATION_ERROR, false),

    // Checkout Domain
    CHECKOUT_SESSION_NOT_FOUND("DOMAIN_CHECKOUT_SESSION_NOT_FOUND", "체크아웃 세션을 찾을 수 없습니다", 404, ErrorCategory.NOT_FOUND, false),
    CHECKOUT_SESSION_EXPIRED("DOMAIN_CHECKOUT_SESSION_EXPIRED", "체크아웃 세션이 만료되었습니다", 410, ErrorCategory.EXPIRED, false),
    CHECKOUT_SESSION_ALREADY_FINALIZED("DOMAIN_CHECKOUT_SESSION_ALREADY_FINALIZED", "이미 처리가 완료된 체크아웃 세션입니다", 409, ErrorCategory.CONFLICT, false),

    // Payment Domain
    INVALID_SIGNATURE("DOMAIN_PAYMENT_INVALID_SIGNATURE", "요청 서명이 유효하지 않습니다", 401, ErrorCategory.INVALID_SIGNATURE, false),
    PAYMENT_UTR_REQUIRED("DOMAIN_PAYMENT_UTR_REQUIRED", "결제 성공 이벤트에는 utr이 필요합니다", 400, ErrorCategory.VALIDATION_ERROR, false),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404, ErrorCategory.NOT_FOUND, false),
    DUPLICATE_ORDER("DOMAIN_ORDER_DUPLICATE", "이미 해당 세션의 주문이 존재합니다", 409, ErrorCategory.CONFLICT, false),

    // ========== Protocol Errors (4XX) ==========

    VALIDATION_ERROR("PROTOCOL_VALIDATION_ERROR", "요청 형식이 올바르지 않습니다", 400, ErrorCategory.VALIDATION_ERROR, false),
    RESOURCE_NOT_FOUND("PROTOCOL_RESOURCE_NOT_FOUND", "요청한 경로를 찾을 수 없습니다", 404, ErrorCategory.NOT_FOUND, false),
    MISSING_REQUIRED_HEADER("PROTOCOL_MISSING_REQUIRED_HEADER", "필수 헤더가 누락되었습니다", 400, ErrorCategory.VALIDATION_ERROR, false),
    INVALID_HEADER_VALUE("PROTOCOL_INVALID_HEADER_VALUE", "헤더 값이 허용 범위를 벗어났습니다", 400, ErrorCategory.VALIDATION_ERROR, false),

    // ========== System Errors (5XX) ==========

    TRANSIENT_STORE_CONTENTION("SYSTEM_TRANSIENT_STORE_CONTENTION", "일시적인 저장소 경합이 발생했습니다. 잠시 후 재시도해 주세요", 503, ErrorCategory.TRANSIENT, true),
    QR_GENERATION_FAILED("SYSTEM_QR_GENERATION_FAILED", "QR 코드 생성에 실패했습니다", 500, ErrorCategory.INTERNAL, false),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500, ErrorCategory.INTERNAL, false);

    private final String code;
    private final String message;
    private final int statusCode;
    private final ErrorCategory category;
    private final boolean retryable;

    ErrorCode(String code, String message, int statusCode, ErrorCategory category, boolean retryable) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
        this.category = category;
        this.retryable = retryable;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
