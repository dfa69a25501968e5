package com.ucp.merchant.common.exception;

/**
 * ApplicationException - 유스케이스 수준의 실패
 *
 * 도메인 규칙은 만족하지만 요청 자체가 처리될 수 없는 경우 (필수 헤더 누락 등)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
