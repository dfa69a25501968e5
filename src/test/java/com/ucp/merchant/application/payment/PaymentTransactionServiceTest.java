package com.ucp.merchant.application.payment;

import com.ucp.merchant.application.order.OrderLedger;
import com.ucp.merchant.application.payment.dto.ConfirmPaymentCommand;
import com.ucp.merchant.application.payment.dto.FailPaymentCommand;
import com.ucp.merchant.application.payment.dto.PaymentResult;
import com.ucp.merchant.common.exception.ErrorCode;
import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.cart.Cart;
import com.ucp.merchant.domain.cart.CartItem;
import com.ucp.merchant.domain.cart.CartRepository;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutSessionExpiredException;
import com.ucp.merchant.domain.checkout.CheckoutSessionFinalizedException;
import com.ucp.merchant.domain.checkout.CheckoutSessionNotFoundException;
import com.ucp.merchant.domain.checkout.CheckoutSessionRepository;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.OrderStatus;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import com.ucp.merchant.domain.payment.InvalidSignatureException;
import com.ucp.merchant.domain.payment.PaymentClaim;
import com.ucp.merchant.domain.payment.PaymentClaimRepository;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.domain.product.ProductRepository;
import com.ucp.merchant.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.ucp.merchant.support.TestFixtures.NOW;
import static com.ucp.merchant.support.TestFixtures.line;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * PaymentTransactionServiceTest - 결제 확인/실패 단위 테스트
 *
 * 트랜잭션과 재시도는 통합 테스트에서 검증하고,
 * 여기서는 처리 순서와 분기별 부수효과만 검증한다.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("PaymentTransactionService 단위 테스트")
class PaymentTransactionServiceTest {

    private static final String BUYER_ID = "buyer-1";
    private static final String SESSION_ID = "cs_test";

    @Mock
    private CheckoutSessionRepository checkoutSessionRepository;

    @Mock
    private PaymentClaimRepository paymentClaimRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CartRepository cartRepository;

    @Mock
    private OrderLedger orderLedger;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private RequestSignatureVerifier signatureVerifier;

    @BeforeEach
    void setup() {
        UcpProperties properties = new UcpProperties();
        properties.getMerchant().setSigningSecret("unit-test-secret");
        signatureVerifier = new RequestSignatureVerifier(properties);
    }

    private PaymentTransactionService serviceAt(LocalDateTime time) {
        Clock clock = Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        return new PaymentTransactionService(checkoutSessionRepository, paymentClaimRepository, productRepository,
                cartRepository, orderLedger, signatureVerifier, eventPublisher, clock);
    }

    private CheckoutSession twoLineSession() {
        return TestFixtures.pendingSession(SESSION_ID, BUYER_ID, line("p2", 1, 1000L), line("p1", 2, 50000L));
    }

    private ConfirmPaymentCommand confirmCommand(CheckoutSession session, String key) {
        return new ConfirmPaymentCommand(session.getId(), "UTR123", key, signatureVerifier.sign(session));
    }

    // ========== 결제 확인 (confirm) ==========

    @Test
    @DisplayName("결제 확인 - 성공: 재고 차감(productId 순), PAID 전이, 주문/원장 기록, 장바구니 정리, 이벤트 발행")
    void testConfirm_Success() {
        // Given
        CheckoutSession session = twoLineSession();
        CartItem purchasedWithExtra = CartItem.create(BUYER_ID, "p1", 3, NOW);
        CartItem purchasedExactly = CartItem.create(BUYER_ID, "p2", 1, NOW);

        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.empty());
        when(productRepository.decrementInventory(anyString(), anyInt(), any(LocalDateTime.class))).thenReturn(true);
        when(checkoutSessionRepository.markPaidIfPending(SESSION_ID, NOW.plusMinutes(1))).thenReturn(true);
        when(orderLedger.recordOrder(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(cartRepository.findByBuyerIdForUpdate(BUYER_ID)).thenReturn(Optional.of(Cart.create(BUYER_ID, NOW)));
        when(cartRepository.findItems(eq(BUYER_ID), anyCollection())).thenReturn(List.of(purchasedWithExtra, purchasedExactly));

        // When
        PaymentResult result = serviceAt(NOW.plusMinutes(1)).confirm(confirmCommand(session, "key-1"));

        // Then
        assertEquals(CheckoutStatus.PAID, result.getSessionStatus());
        assertEquals("UTR123", result.getUtr());
        assertFalse(result.isReplayed());
        assertNotNull(result.getOrderId());

        InOrder inventoryOrder = inOrder(productRepository);
        inventoryOrder.verify(productRepository).decrementInventory("p1", 2, NOW.plusMinutes(1));
        inventoryOrder.verify(productRepository).decrementInventory("p2", 1, NOW.plusMinutes(1));

        ArgumentCaptor<Order> orderCaptor = ArgumentCaptor.forClass(Order.class);
        verify(orderLedger).recordOrder(orderCaptor.capture());
        assertEquals(OrderStatus.COMPLETED, orderCaptor.getValue().getStatus());
        assertEquals(101000L, orderCaptor.getValue().getTotalMinorUnits());

        assertEquals(1, purchasedWithExtra.getQuantity());
        verify(cartRepository).saveItem(purchasedWithExtra);
        verify(cartRepository).deleteItem(purchasedExactly);

        ArgumentCaptor<PaymentClaim> claimCaptor = ArgumentCaptor.forClass(PaymentClaim.class);
        verify(paymentClaimRepository).insert(claimCaptor.capture());
        assertEquals(CheckoutStatus.PAID, claimCaptor.getValue().getOutcome());
        assertEquals(result.getOrderId(), claimCaptor.getValue().getOrderId());

        verify(eventPublisher).publishEvent(any(OrderRecordedEvent.class));
    }

    @Test
    @DisplayName("결제 확인 - 서명 불일치 → InvalidSignatureException, 상태 변경 없음")
    void testConfirm_InvalidSignature() {
        // Given
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        ConfirmPaymentCommand forged = new ConfirmPaymentCommand(SESSION_ID, "UTR123", "key-1", "deadbeef");

        // When & Then
        assertThrows(InvalidSignatureException.class, () -> serviceAt(NOW).confirm(forged));
        verifyNoInteractions(paymentClaimRepository, productRepository, cartRepository, orderLedger, eventPublisher);
        verify(checkoutSessionRepository, never()).markPaidIfPending(anyString(), any());
    }

    @Test
    @DisplayName("결제 확인 - 서명 누락 → InvalidSignatureException")
    void testConfirm_MissingSignature() {
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));

        assertThrows(InvalidSignatureException.class, () ->
                serviceAt(NOW).confirm(new ConfirmPaymentCommand(SESSION_ID, "UTR123", "key-1", null)));
    }

    @Test
    @DisplayName("결제 확인 - 같은 멱등성 키 재전송은 기존 결과 반환 (부수효과 없음)")
    void testConfirm_Replay() {
        // Given
        CheckoutSession session = twoLineSession();
        ReflectionTestUtils.setField(session, "status", CheckoutStatus.PAID);
        PaymentClaim prior = PaymentClaim.record(SESSION_ID, "key-1", "UTR123", CheckoutStatus.PAID, "ord_prior", NOW);
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.of(prior));

        // When
        PaymentResult result = serviceAt(NOW.plusMinutes(1)).confirm(confirmCommand(session, "key-1"));

        // Then
        assertTrue(result.isReplayed());
        assertEquals("ord_prior", result.getOrderId());
        assertEquals(CheckoutStatus.PAID, result.getSessionStatus());
        verifyNoInteractions(productRepository, cartRepository, orderLedger, eventPublisher);
        verify(paymentClaimRepository, never()).insert(any());
    }

    @Test
    @DisplayName("결제 확인 - 다른 키로 종결 세션 재확인 → CheckoutSessionFinalizedException")
    void testConfirm_AlreadyFinalized() {
        // Given
        CheckoutSession session = twoLineSession();
        ReflectionTestUtils.setField(session, "status", CheckoutStatus.PAID);
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-2")).thenReturn(Optional.empty());

        // When & Then
        CheckoutSessionFinalizedException exception = assertThrows(CheckoutSessionFinalizedException.class,
                () -> serviceAt(NOW).confirm(confirmCommand(session, "key-2")));
        assertEquals(ErrorCode.CHECKOUT_SESSION_ALREADY_FINALIZED, exception.getErrorCode());
        verifyNoInteractions(productRepository, orderLedger);
    }

    @Test
    @DisplayName("결제 확인 - 만료 시각 경과 → CheckoutSessionExpiredException, 재고 변경 없음")
    void testConfirm_Expired() {
        // Given
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.empty());

        // When & Then
        assertThrows(CheckoutSessionExpiredException.class,
                () -> serviceAt(NOW.plusMinutes(15)).confirm(confirmCommand(session, "key-1")));
        verifyNoInteractions(productRepository, orderLedger, cartRepository);
    }

    @Test
    @DisplayName("결제 확인 - 재고 차감 실패 → FULFILLMENT_BLOCKED (재시도 가능), 세션 전이 없음")
    void testConfirm_FulfillmentBlocked() {
        // Given
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.empty());
        when(productRepository.decrementInventory("p1", 2, NOW)).thenReturn(true);
        when(productRepository.decrementInventory("p2", 1, NOW)).thenReturn(false);

        // When
        InsufficientInventoryException exception = assertThrows(InsufficientInventoryException.class,
                () -> serviceAt(NOW).confirm(confirmCommand(session, "key-1")));

        // Then
        assertEquals(ErrorCode.FULFILLMENT_BLOCKED, exception.getErrorCode());
        assertTrue(exception.getErrorCode().isRetryable());
        verify(checkoutSessionRepository, never()).markPaidIfPending(anyString(), any());
        verifyNoInteractions(orderLedger, eventPublisher);
    }

    @Test
    @DisplayName("결제 확인 - 조건부 전이 실패 → ConcurrencyFailureException (재시도 대상)")
    void testConfirm_TransitionRace() {
        // Given
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.empty());
        when(productRepository.decrementInventory(anyString(), anyInt(), any(LocalDateTime.class))).thenReturn(true);
        when(checkoutSessionRepository.markPaidIfPending(SESSION_ID, NOW)).thenReturn(false);

        // When & Then
        assertThrows(ConcurrencyFailureException.class, () -> serviceAt(NOW).confirm(confirmCommand(session, "key-1")));
        verifyNoInteractions(orderLedger, eventPublisher);
    }

    @Test
    @DisplayName("결제 확인 - 없는 세션 → CheckoutSessionNotFoundException")
    void testConfirm_NotFound() {
        when(checkoutSessionRepository.findByIdForUpdate("cs_missing")).thenReturn(Optional.empty());

        assertThrows(CheckoutSessionNotFoundException.class, () ->
                serviceAt(NOW).confirm(new ConfirmPaymentCommand("cs_missing", "UTR1", "key-1", "sig")));
    }

    @Test
    @DisplayName("결제 확인 - 장바구니 행이 없으면 정리 단계는 건너뛴다")
    void testConfirm_NoCartRow() {
        // Given
        CheckoutSession session = TestFixtures.pendingSession(SESSION_ID, BUYER_ID, line("p1", 1, 100L));
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-1")).thenReturn(Optional.empty());
        when(productRepository.decrementInventory("p1", 1, NOW)).thenReturn(true);
        when(checkoutSessionRepository.markPaidIfPending(SESSION_ID, NOW)).thenReturn(true);
        when(orderLedger.recordOrder(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(cartRepository.findByBuyerIdForUpdate(BUYER_ID)).thenReturn(Optional.empty());

        // When
        PaymentResult result = serviceAt(NOW).confirm(confirmCommand(session, "key-1"));

        // Then
        assertEquals(CheckoutStatus.PAID, result.getSessionStatus());
        verify(cartRepository, never()).findItems(anyString(), anyCollection());
    }

    // ========== 결제 실패 (fail) ==========

    @Test
    @DisplayName("결제 실패 - PENDING → FAILED, 실패 주문 기록, 재고/장바구니 변경 없음")
    void testFail_Success() {
        // Given
        CheckoutSession session = twoLineSession();
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-f")).thenReturn(Optional.empty());
        when(checkoutSessionRepository.markFailedIfOpen(SESSION_ID, NOW)).thenReturn(true);
        when(orderLedger.recordOrder(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FailPaymentCommand command = new FailPaymentCommand(SESSION_ID, null, "key-f",
                signatureVerifier.sign(session), FailPaymentCommand.REASON_CANCELED_BY_BUYER);

        // When
        PaymentResult result = serviceAt(NOW).fail(command);

        // Then
        assertEquals(CheckoutStatus.FAILED, result.getSessionStatus());
        ArgumentCaptor<Order> orderCaptor = ArgumentCaptor.forClass(Order.class);
        verify(orderLedger).recordOrder(orderCaptor.capture());
        assertEquals(OrderStatus.FAILED, orderCaptor.getValue().getStatus());
        assertEquals("CANCELED_BY_BUYER", orderCaptor.getValue().getFailureReason());
        verifyNoInteractions(productRepository, cartRepository);
        verify(eventPublisher).publishEvent(any(OrderRecordedEvent.class));
    }

    @Test
    @DisplayName("결제 실패 - 만료된 세션도 명시적 실패 통지로 FAILED 전이 가능")
    void testFail_ExpiredSession() {
        // Given
        CheckoutSession session = twoLineSession();
        ReflectionTestUtils.setField(session, "status", CheckoutStatus.EXPIRED);
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-f")).thenReturn(Optional.empty());
        when(checkoutSessionRepository.markFailedIfOpen(SESSION_ID, NOW.plusHours(1))).thenReturn(true);
        when(orderLedger.recordOrder(any(Order.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FailPaymentCommand command = new FailPaymentCommand(SESSION_ID, "UTR9", "key-f",
                signatureVerifier.sign(session), FailPaymentCommand.REASON_PAYMENT_DECLINED);

        // When
        PaymentResult result = serviceAt(NOW.plusHours(1)).fail(command);

        // Then
        assertEquals(CheckoutStatus.FAILED, result.getSessionStatus());
        assertEquals("UTR9", result.getUtr());
    }

    @Test
    @DisplayName("결제 실패 - PAID 세션 → CheckoutSessionFinalizedException")
    void testFail_AlreadyPaid() {
        // Given
        CheckoutSession session = twoLineSession();
        ReflectionTestUtils.setField(session, "status", CheckoutStatus.PAID);
        when(checkoutSessionRepository.findByIdForUpdate(SESSION_ID)).thenReturn(Optional.of(session));
        when(paymentClaimRepository.findBySessionAndKey(SESSION_ID, "key-f")).thenReturn(Optional.empty());

        FailPaymentCommand command = new FailPaymentCommand(SESSION_ID, null, "key-f",
                signatureVerifier.sign(session), FailPaymentCommand.REASON_PAYMENT_DECLINED);

        // When & Then
        assertThrows(CheckoutSessionFinalizedException.class, () -> serviceAt(NOW).fail(command));
        verify(checkoutSessionRepository, never()).markFailedIfOpen(anyString(), any());
    }
}
