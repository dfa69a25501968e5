package com.ucp.merchant.domain.order;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생 (404)
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(String orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "orderId=" + orderId);
    }
}
