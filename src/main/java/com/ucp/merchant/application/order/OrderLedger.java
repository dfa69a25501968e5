package com.ucp.merchant.application.order;

import com.ucp.merchant.domain.order.DuplicateOrderException;
import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.OrderNotFoundException;
import com.ucp.merchant.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * OrderLedger - 주문 원장 (추가 전용)
 *
 * 세션당 주문 하나를 보장하는 최후 방어선이다.
 * 기본 보장은 결제 확인 단계의 세션 락과 멱등성 원장이 담당한다.
 */
@Service
public class OrderLedger {

    private static final Logger log = LoggerFactory.getLogger(OrderLedger.class);

    private final OrderRepository orderRepository;

    public OrderLedger(OrderRepository orderRepository) {
        this.orderRepository = orderRepository;
    }

    /**
     * 주문 기록 (호출자 트랜잭션에 참여)
     *
     * @throws DuplicateOrderException 같은 세션의 주문이 이미 있는 경우
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Order recordOrder(Order order) {
        if (orderRepository.existsByCheckoutSessionId(order.getCheckoutSessionId())) {
            throw new DuplicateOrderException(order.getCheckoutSessionId());
        }
        try {
            Order saved = orderRepository.append(order);
            log.info("주문 기록: orderId={}, sessionId={}, status={}, utr={}",
                    saved.getOrderId(), saved.getCheckoutSessionId(), saved.getStatus(), saved.getUtr());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new DuplicateOrderException(order.getCheckoutSessionId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Order findOrder(String orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    @Transactional(readOnly = true)
    public Optional<Order> findOrderByCheckoutSession(String checkoutSessionId) {
        return orderRepository.findByCheckoutSessionId(checkoutSessionId);
    }
}
