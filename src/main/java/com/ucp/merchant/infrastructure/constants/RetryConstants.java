package com.ucp.merchant.infrastructure.constants;

/**
 * RetryConstants - 재시도 로직 설정 상수
 *
 * 역할:
 * - 저장소 경합(락 대기 초과, 데드락, 조건부 UPDATE 경합) 재시도 설정 통일
 * - @Retryable 어노테이션 속성은 컴파일 타임 상수여야 하므로 여기서 관리
 */
public final class RetryConstants {

    // ========== Payment Reconciliation ==========

    /** 결제 확인/실패 처리 최대 시도 횟수 */
    public static final int PAYMENT_MAX_ATTEMPTS = 3;

    /** 초기 딜레이 (밀리초) */
    public static final long PAYMENT_INITIAL_DELAY_MS = 50L;

    /** 지수 백오프 배수 */
    public static final int PAYMENT_BACKOFF_MULTIPLIER = 2;

    /** 최대 딜레이 (밀리초) */
    public static final long PAYMENT_MAX_DELAY_MS = 1000L;

    // ========== Cart / Checkout ==========

    /** 장바구니 행 최초 생성 경합 재시도 횟수 */
    public static final int CART_MAX_ATTEMPTS = 3;

    /** 장바구니 재시도 딜레이 (밀리초) */
    public static final long CART_INITIAL_DELAY_MS = 20L;

    private RetryConstants() {
        throw new AssertionError("RetryConstants는 인스턴스화할 수 없습니다");
    }
}
