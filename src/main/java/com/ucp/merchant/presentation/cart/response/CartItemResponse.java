package com.ucp.merchant.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 아이템 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {

    @JsonProperty("product_id")
    private String productId;

    private String title;

    private Integer quantity;

    @JsonProperty("unit_price")
    private Long unitPrice;

    private Long subtotal;
}
