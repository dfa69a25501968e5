package com.ucp.merchant.domain.checkout;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 빈 장바구니로 체크아웃을 시도한 경우
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(String buyerId) {
        super(ErrorCode.EMPTY_CART, "buyerId=" + buyerId);
    }
}
