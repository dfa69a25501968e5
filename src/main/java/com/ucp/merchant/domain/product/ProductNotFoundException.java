package com.ucp.merchant.domain.product;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생 (404)
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(String productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }
}
