package com.ucp.merchant.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 * (buyerId, productId) 당 하나의 라인 항목. 수량은 항상 1 이상이다.
 * 가격은 저장하지 않는다 (장바구니 조회 시 카탈로그의 현재 가격 사용).
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
        @UniqueConstraint(name = "uk_cart_items_buyer_product", columnNames = {"buyer_id", "product_id"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CartItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "buyer_id", nullable = false, length = 128)
    private String buyerId;

    @Column(name = "product_id", nullable = false, length = 64)
    private String productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static CartItem create(String buyerId, String productId, int quantity, LocalDateTime now) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        return CartItem.builder()
                .buyerId(buyerId)
                .productId(productId)
                .quantity(quantity)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void changeQuantity(int quantity, LocalDateTime now) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        this.quantity = quantity;
        this.updatedAt = now;
    }
}
