package com.ucp.merchant.domain.payment;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 결제 성공 통보에 UTR이 없는 경우 (400)
 */
public class MissingUtrException extends DomainException {

    public MissingUtrException(String checkoutSessionId) {
        super(ErrorCode.PAYMENT_UTR_REQUIRED, "checkoutSessionId=" + checkoutSessionId);
    }
}
