package com.ucp.merchant.presentation.common;

/**
 * UCP 프로토콜 헤더 이름
 */
public final class UcpHeaders {

    public static final String AGENT = "UCP-Agent";
    public static final String IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String REQUEST_SIGNATURE = "Request-Signature";
    public static final String REQUEST_ID = "Request-Id";

    /** payment_claims.idempotency_key, checkout_sessions.creation_key 컬럼 길이 */
    public static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    /** 구매자 식별 헤더 */
    public static final String BUYER_ID = "X-BUYER-ID";

    /** MDC 키 */
    public static final String MDC_REQUEST_ID = "requestId";

    private UcpHeaders() {
        throw new AssertionError("UcpHeaders는 인스턴스화할 수 없습니다");
    }
}
