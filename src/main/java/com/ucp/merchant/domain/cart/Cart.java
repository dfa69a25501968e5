package com.ucp.merchant.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Cart 도메인 엔티티
 *
 * 장바구니는 구매자 외에 별도의 식별자를 갖지 않는다.
 * 이 행은 구매자별 장바구니 변경을 직렬화하기 위한 락 대상(SELECT ... FOR UPDATE)이다.
 */
@Entity
@Table(name = "carts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Cart {

    @Id
    @Column(name = "buyer_id", length = 128)
    private String buyerId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart create(String buyerId, LocalDateTime now) {
        return new Cart(buyerId, now, now);
    }

    public void touch(LocalDateTime now) {
        this.updatedAt = now;
    }
}
