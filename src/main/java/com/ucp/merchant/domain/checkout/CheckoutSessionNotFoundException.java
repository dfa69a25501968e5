package com.ucp.merchant.domain.checkout;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 체크아웃 세션을 찾을 수 없을 때 발생 (404)
 */
public class CheckoutSessionNotFoundException extends DomainException {

    public CheckoutSessionNotFoundException(String checkoutSessionId) {
        super(ErrorCode.CHECKOUT_SESSION_NOT_FOUND, "checkoutSessionId=" + checkoutSessionId);
    }
}
