package com.ucp.merchant.domain.checkout;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 생성 시점에 고정된 라인 항목 스냅샷
 * 이후의 카탈로그 가격 변경이나 장바구니 변경과 무관하다.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckoutLineItem {

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false)
    private Long unitPrice;

    @Column(name = "subtotal", nullable = false)
    private Long subtotal;

    private CheckoutLineItem(String productId, String title, int quantity, long unitPrice) {
        this.productId = productId;
        this.title = title;
        this.quantity = quantity;
        this.unitPrice = unitPrice;
        this.subtotal = unitPrice * quantity;
    }

    public static CheckoutLineItem snapshot(String productId, String title, int quantity, long unitPrice) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("라인 항목 수량은 1 이상이어야 합니다");
        }
        if (unitPrice <= 0) {
            throw new IllegalArgumentException("단가는 0보다 커야 합니다");
        }
        return new CheckoutLineItem(productId, title, quantity, unitPrice);
    }
}
