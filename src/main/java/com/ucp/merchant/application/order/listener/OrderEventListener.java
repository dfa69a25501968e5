package com.ucp.merchant.application.order.listener;

import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import com.ucp.merchant.infrastructure.kafka.OrderEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * OrderEventListener - 주문 원장 기록 이벤트 리스너
 *
 * 처리 시점: AFTER_COMMIT
 * - 결제 트랜잭션이 커밋된 경우에만 실행 (롤백 시 이벤트 없음)
 *
 * 실패 처리:
 * - 발행 실패는 로깅만 하고 전파하지 않음 (주문은 이미 확정됨)
 *
 * Kafka 발행은 ucp.events.kafka.enabled=true 일 때만 OrderEventProducer 빈이 존재한다.
 */
@Component
public class OrderEventListener {

    private static final Logger log = LoggerFactory.getLogger(OrderEventListener.class);

    private final ObjectProvider<OrderEventProducer> orderEventProducer;

    public OrderEventListener(ObjectProvider<OrderEventProducer> orderEventProducer) {
        this.orderEventProducer = orderEventProducer;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleOrderRecorded(OrderRecordedEvent event) {
        log.info("[OrderEventListener] 주문 이벤트 수신 - orderId={}, sessionId={}, status={}, total={}",
                event.getOrderId(), event.getCheckoutSessionId(), event.getStatus(), event.getTotalMinorUnits());

        try {
            orderEventProducer.ifAvailable(producer -> producer.publish(event));
        } catch (Exception e) {
            log.error("[OrderEventListener] 주문 이벤트 발행 실패 - orderId={}, error={}",
                    event.getOrderId(), e.getMessage(), e);
        }
    }
}
