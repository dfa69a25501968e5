package com.ucp.merchant.domain.checkout;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 만료된(또는 만료 시각이 지난 PENDING) 세션에 대한 결제 확인 (410)
 * 어떤 상태 변경도 수행되지 않는다.
 */
public class CheckoutSessionExpiredException extends DomainException {

    public CheckoutSessionExpiredException(String checkoutSessionId) {
        super(ErrorCode.CHECKOUT_SESSION_EXPIRED, "checkoutSessionId=" + checkoutSessionId);
    }
}
