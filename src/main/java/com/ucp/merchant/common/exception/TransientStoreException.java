package com.ucp.merchant.common.exception;

/**
 * 재시도 한도를 모두 소진한 저장소 경합 (503)
 *
 * 멱등성 키 계약 덕분에 호출자는 동일한 키로 안전하게 재시도할 수 있다.
 */
public class TransientStoreException extends SystemException {

    public TransientStoreException(String detailMessage, Throwable cause) {
        super(ErrorCode.TRANSIENT_STORE_CONTENTION, detailMessage, cause);
    }
}
