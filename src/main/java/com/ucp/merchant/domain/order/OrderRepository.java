package com.ucp.merchant.domain.order;

import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 추가 전용: 수정/삭제 메서드를 제공하지 않는다.
 */
public interface OrderRepository {

    /**
     * 주문 추가 (즉시 flush)
     * 같은 세션의 주문이 이미 있으면 DuplicateKeyException이 전파된다.
     */
    Order append(Order order);

    Optional<Order> findById(String orderId);

    Optional<Order> findByCheckoutSessionId(String checkoutSessionId);

    boolean existsByCheckoutSessionId(String checkoutSessionId);

    long countByCheckoutSessionId(String checkoutSessionId);
}
