package com.ucp.merchant.common.exception;

/**
 * SystemException - 시스템 수준 오류
 *
 * 저장소 경합, QR 인코딩 실패 등 요청 내용과 무관한 오류
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
