package com.ucp.merchant.infrastructure.persistence.order;

import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.OrderRepository;
import com.ucp.merchant.infrastructure.persistence.UniqueKeyViolations;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현 (추가 전용)
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order append(Order order) {
        try {
            return orderJpaRepository.saveAndFlush(order);
        } catch (DataIntegrityViolationException e) {
            throw UniqueKeyViolations.classify(e);
        }
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findByCheckoutSessionId(String checkoutSessionId) {
        return orderJpaRepository.findByCheckoutSessionId(checkoutSessionId);
    }

    @Override
    public boolean existsByCheckoutSessionId(String checkoutSessionId) {
        return orderJpaRepository.existsByCheckoutSessionId(checkoutSessionId);
    }

    @Override
    public long countByCheckoutSessionId(String checkoutSessionId) {
        return orderJpaRepository.countByCheckoutSessionId(checkoutSessionId);
    }
}
