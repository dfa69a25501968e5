package com.ucp.merchant.presentation.checkout.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutLineItemResponse {

    @JsonProperty("product_id")
    private String productId;

    private String title;

    private Integer quantity;

    @JsonProperty("unit_price")
    private Long unitPrice;

    private Long subtotal;
}
