package com.ucp.merchant.domain.checkout;

/**
 * 체크아웃 세션 상태
 *
 * 상태 전이:
 * - PENDING → PAID    (유효한 결제 확인 + 재고 차감 성공)
 * - PENDING → FAILED  (명시적 결제 실패 통지 또는 구매자 취소)
 * - PENDING → EXPIRED (만료 시각 경과, 조회 시점 판정 또는 정리 작업)
 * - EXPIRED → FAILED  (명시적 결제 실패 통지만 허용)
 *
 * PAID, FAILED는 종결 상태이다.
 */
public enum CheckoutStatus {
    PENDING("결제 대기"),
    PAID("결제 완료"),
    FAILED("결제 실패"),
    EXPIRED("만료");

    private final String displayName;

    CheckoutStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == PAID || this == FAILED;
    }
}
