package com.ucp.merchant.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 장바구니 라인 (카탈로그 현재 가격 기준)
 */
@Getter
@Builder
@AllArgsConstructor
public class CartLineView {
    private String productId;
    private String title;
    private Integer quantity;
    private Long unitPrice;
    private Long subtotal;
}
