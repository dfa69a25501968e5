package com.ucp.merchant.application.order;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.order.DuplicateOrderException;
import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.OrderNotFoundException;
import com.ucp.merchant.domain.order.OrderRepository;
import com.ucp.merchant.support.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.util.Optional;

import static com.ucp.merchant.support.TestFixtures.NOW;
import static com.ucp.merchant.support.TestFixtures.line;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderLedger 단위 테스트")
class OrderLedgerTest {

    @Mock
    private OrderRepository orderRepository;

    @InjectMocks
    private OrderLedger orderLedger;

    private final CheckoutSession session = TestFixtures.pendingSession("cs_1", "buyer-1", line("p1", 1, 100L));

    @Test
    @DisplayName("주문 기록 - 성공")
    void testRecordOrder_Success() {
        Order order = Order.completed(session, "UTR1", NOW);
        when(orderRepository.existsByCheckoutSessionId("cs_1")).thenReturn(false);
        when(orderRepository.append(order)).thenReturn(order);

        assertSame(order, orderLedger.recordOrder(order));
    }

    @Test
    @DisplayName("주문 기록 - 같은 세션 주문 존재 → DuplicateOrderException")
    void testRecordOrder_Duplicate() {
        when(orderRepository.existsByCheckoutSessionId("cs_1")).thenReturn(true);

        assertThrows(DuplicateOrderException.class, () -> orderLedger.recordOrder(Order.completed(session, "UTR1", NOW)));
        verify(orderRepository, never()).append(any());
    }

    @Test
    @DisplayName("주문 기록 - UNIQUE 제약 위반도 DuplicateOrderException")
    void testRecordOrder_UniqueConstraint() {
        when(orderRepository.existsByCheckoutSessionId("cs_1")).thenReturn(false);
        when(orderRepository.append(any(Order.class))).thenThrow(new DuplicateKeyException("uk_orders_checkout_session"));

        DuplicateOrderException exception = assertThrows(DuplicateOrderException.class,
                () -> orderLedger.recordOrder(Order.completed(session, "UTR1", NOW)));
        assertInstanceOf(DuplicateKeyException.class, exception.getCause());
    }

    @Test
    @DisplayName("주문 조회 - 없음 → OrderNotFoundException")
    void testFindOrder_NotFound() {
        when(orderRepository.findById("ord_missing")).thenReturn(Optional.empty());

        assertThrows(OrderNotFoundException.class, () -> orderLedger.findOrder("ord_missing"));
    }
}
