package com.ucp.merchant.domain.payment;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 요청 서명이 세션의 고정 페이로드와 일치하지 않는 경우 (401)
 * 이 예외는 어떤 상태 변경도 일으키지 않는다.
 */
public class InvalidSignatureException extends DomainException {

    public InvalidSignatureException(String checkoutSessionId) {
        super(ErrorCode.INVALID_SIGNATURE, "checkoutSessionId=" + checkoutSessionId);
    }
}
