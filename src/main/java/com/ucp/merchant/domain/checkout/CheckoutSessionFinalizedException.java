package com.ucp.merchant.domain.checkout;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;
import lombok.Getter;

/**
 * 이미 PAID/FAILED로 종결된 세션에 다른 멱등성 키로 요청한 경우 (409)
 */
@Getter
public class CheckoutSessionFinalizedException extends DomainException {

    private final CheckoutStatus status;

    public CheckoutSessionFinalizedException(String checkoutSessionId, CheckoutStatus status) {
        super(ErrorCode.CHECKOUT_SESSION_ALREADY_FINALIZED, "checkoutSessionId=" + checkoutSessionId + ", status=" + status);
        this.status = status;
    }
}
