package com.ucp.merchant.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 장바구니 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class CartView {
    private String buyerId;
    private List<CartLineView> items;
    private Integer totalItems;
    private Long totalMinorUnits;

    public static CartView of(String buyerId, List<CartLineView> items) {
        return CartView.builder()
                .buyerId(buyerId)
                .items(items)
                .totalItems(items.stream().mapToInt(CartLineView::getQuantity).sum())
                .totalMinorUnits(items.stream().mapToLong(CartLineView::getSubtotal).sum())
                .build();
    }
}
