package com.ucp.merchant.domain.order;

/**
 * 주문 상태 (생성 즉시 종결)
 */
public enum OrderStatus {
    COMPLETED("주문 완료"),
    FAILED("주문 실패");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
