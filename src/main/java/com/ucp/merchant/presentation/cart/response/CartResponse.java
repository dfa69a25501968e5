package com.ucp.merchant.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("buyer_id")
    private String buyerId;

    private List<CartItemResponse> items;

    @JsonProperty("total_items")
    private Integer totalItems;

    @JsonProperty("total_price")
    private Long totalPrice;

    private String currency;
}
