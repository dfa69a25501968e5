package com.ucp.merchant.domain.order;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 동일 세션에 대한 주문이 이미 존재하는 경우 (409)
 * 멱등성 원장 뒤에 있는 최후 방어선이다.
 */
public class DuplicateOrderException extends DomainException {

    public DuplicateOrderException(String checkoutSessionId) {
        super(ErrorCode.DUPLICATE_ORDER, "checkoutSessionId=" + checkoutSessionId);
    }

    public DuplicateOrderException(String checkoutSessionId, Throwable cause) {
        super(ErrorCode.DUPLICATE_ORDER, cause);
    }
}
