package com.ucp.merchant.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AddCartItemCommand {
    private String productId;
    private Integer quantity;
}
