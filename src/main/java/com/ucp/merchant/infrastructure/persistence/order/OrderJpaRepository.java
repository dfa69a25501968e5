package com.ucp.merchant.infrastructure.persistence.order;

import com.ucp.merchant.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, String> {

    Optional<Order> findByCheckoutSessionId(String checkoutSessionId);

    boolean existsByCheckoutSessionId(String checkoutSessionId);

    long countByCheckoutSessionId(String checkoutSessionId);
}
