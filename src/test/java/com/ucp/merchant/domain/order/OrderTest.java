package com.ucp.merchant.domain.order;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import com.ucp.merchant.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ucp.merchant.support.TestFixtures.NOW;
import static com.ucp.merchant.support.TestFixtures.line;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Order 도메인 테스트")
class OrderTest {

    @Test
    @DisplayName("완료 주문 - 세션의 구매자, 합계, UTR 보관")
    void testCompleted() {
        // Given
        CheckoutSession session = TestFixtures.pendingSession("cs_1", "buyer-1", line("p1", 2, 50000L));

        // When
        Order order = Order.completed(session, "UTR123", NOW);

        // Then
        assertTrue(order.getOrderId().startsWith("ord_"));
        assertEquals("cs_1", order.getCheckoutSessionId());
        assertEquals("buyer-1", order.getBuyerId());
        assertEquals(OrderStatus.COMPLETED, order.getStatus());
        assertEquals("UTR123", order.getUtr());
        assertEquals(100000L, order.getTotalMinorUnits());
        assertNull(order.getFailureReason());
    }

    @Test
    @DisplayName("실패 주문 - 실패 사유 보관, UTR 없음 허용")
    void testFailed() {
        CheckoutSession session = TestFixtures.pendingSession("cs_1", "buyer-1", line("p1", 1, 100L));

        Order order = Order.failed(session, null, "CANCELED_BY_BUYER", NOW);

        assertEquals(OrderStatus.FAILED, order.getStatus());
        assertEquals("CANCELED_BY_BUYER", order.getFailureReason());
        assertNull(order.getUtr());
    }

    @Test
    @DisplayName("주문 이벤트 변환")
    void testOrderRecordedEvent() {
        CheckoutSession session = TestFixtures.pendingSession("cs_1", "buyer-1", line("p1", 1, 100L));
        Order order = Order.completed(session, "UTR1", NOW);

        OrderRecordedEvent event = OrderRecordedEvent.from(order);

        assertEquals(order.getOrderId(), event.getOrderId());
        assertEquals("cs_1", event.getCheckoutSessionId());
        assertEquals(OrderStatus.COMPLETED, event.getStatus());
        assertEquals(NOW, event.getOccurredAt());
    }
}
