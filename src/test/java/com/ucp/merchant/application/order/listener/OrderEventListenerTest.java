package com.ucp.merchant.application.order.listener;

import com.ucp.merchant.domain.order.OrderStatus;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import com.ucp.merchant.infrastructure.kafka.OrderEventProducer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.LocalDateTime;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderEventListener 단위 테스트")
class OrderEventListenerTest {

    @Mock
    private ObjectProvider<OrderEventProducer> producerProvider;

    @Mock
    private OrderEventProducer producer;

    private final OrderRecordedEvent event = new OrderRecordedEvent("ord_1", "cs_1", "buyer-1",
            OrderStatus.COMPLETED, "UTR1", 100000L, null, LocalDateTime.of(2026, 1, 11, 12, 0));

    @Test
    @DisplayName("Kafka 프로듀서가 있으면 이벤트 전달")
    @SuppressWarnings("unchecked")
    void testHandle_ForwardsToProducer() {
        // Given
        doAnswer(invocation -> {
            ((Consumer<OrderEventProducer>) invocation.getArgument(0)).accept(producer);
            return null;
        }).when(producerProvider).ifAvailable(any());

        // When
        new OrderEventListener(producerProvider).handleOrderRecorded(event);

        // Then
        verify(producer).publish(event);
    }

    @Test
    @DisplayName("발행 실패는 전파되지 않는다 (주문은 이미 확정)")
    void testHandle_PublishFailureContained() {
        doThrow(new IllegalStateException("kafka unavailable")).when(producerProvider).ifAvailable(any());

        assertDoesNotThrow(() -> new OrderEventListener(producerProvider).handleOrderRecorded(event));
    }
}
