package com.ucp.merchant.infrastructure.kafka;

import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * OrderEventProducer - Kafka 주문 이벤트 발행
 *
 * Kafka 메시지 구조:
 * - Key: checkoutSessionId → 같은 세션의 이벤트는 같은 파티션 (순서 보장)
 * - Value: OrderRecordedEvent (JSON)
 *
 * 전송 실패는 콜백에서 로깅만 한다 (재시도는 프로듀서 retries 설정).
 */
@Service
@ConditionalOnProperty(prefix = "ucp.events.kafka", name = "enabled", havingValue = "true")
public class OrderEventProducer {

    private static final Logger log = LoggerFactory.getLogger(OrderEventProducer.class);

    private final KafkaTemplate<String, OrderRecordedEvent> orderEventKafkaTemplate;
    private final String topicName;

    public OrderEventProducer(KafkaTemplate<String, OrderRecordedEvent> orderEventKafkaTemplate,
                              UcpProperties properties) {
        this.orderEventKafkaTemplate = orderEventKafkaTemplate;
        this.topicName = properties.getEvents().getKafka().getTopic();
    }

    public void publish(OrderRecordedEvent event) {
        String key = event.getCheckoutSessionId();

        log.info("[OrderEventProducer] Kafka 메시지 발행 시작 - topic={}, key={}, orderId={}, status={}",
                topicName, key, event.getOrderId(), event.getStatus());

        CompletableFuture<SendResult<String, OrderRecordedEvent>> future =
                orderEventKafkaTemplate.send(topicName, key, event);

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                var metadata = result.getRecordMetadata();
                log.info("[OrderEventProducer] Kafka 메시지 발행 성공 - topic={}, partition={}, offset={}, orderId={}",
                        metadata.topic(), metadata.partition(), metadata.offset(), event.getOrderId());
            } else {
                log.error("[OrderEventProducer] Kafka 메시지 발행 실패 - topic={}, key={}, orderId={}, error={}",
                        topicName, key, event.getOrderId(), ex.getMessage(), ex);
            }
        });
    }
}
