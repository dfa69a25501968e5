package com.ucp.merchant.application.payment;

import com.ucp.merchant.application.order.OrderLedger;
import com.ucp.merchant.application.payment.dto.ConfirmPaymentCommand;
import com.ucp.merchant.application.payment.dto.FailPaymentCommand;
import com.ucp.merchant.application.payment.dto.PaymentResult;
import com.ucp.merchant.domain.cart.CartItem;
import com.ucp.merchant.domain.cart.CartRepository;
import com.ucp.merchant.domain.checkout.CheckoutLineItem;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutSessionExpiredException;
import com.ucp.merchant.domain.checkout.CheckoutSessionFinalizedException;
import com.ucp.merchant.domain.checkout.CheckoutSessionNotFoundException;
import com.ucp.merchant.domain.checkout.CheckoutSessionRepository;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import com.ucp.merchant.domain.payment.PaymentClaim;
import com.ucp.merchant.domain.payment.PaymentClaimRepository;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.domain.product.ProductRepository;
import com.ucp.merchant.infrastructure.constants.RetryConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PaymentTransactionService - 결제 확인/실패의 단일 트랜잭션 처리
 *
 * 역할:
 * - 세션 전이, 재고 차감, 주문 기록, 장바구니 정리, 멱등성 원장 기록을 하나의 트랜잭션으로 처리
 * - 어느 단계든 실패하면 전체 롤백되어 세션은 PENDING으로 남는다
 *
 * 동시성 제어:
 * - 세션 행 SELECT ... FOR UPDATE로 같은 세션의 요청 직렬화
 * - 재고 차감/상태 전이는 조건부 UPDATE
 * - 락 순서: 세션 → 상품(productId 오름차순) → 장바구니
 *
 * 재시도 (@Retryable, 트랜잭션 바깥에서 동작):
 * - TransientDataAccessException: 락 대기 초과, 데드락, 조건부 전이 경합
 * - DuplicateKeyException: 멱등성 원장 UNIQUE 경합 (재시도 시 기존 결과 반환)
 * - 그 밖의 무결성 위반(값 길이 초과 등)은 재시도하지 않는다
 */
@Service
public class PaymentTransactionService {

    private static final Logger log = LoggerFactory.getLogger(PaymentTransactionService.class);

    private final CheckoutSessionRepository checkoutSessionRepository;
    private final PaymentClaimRepository paymentClaimRepository;
    private final ProductRepository productRepository;
    private final CartRepository cartRepository;
    private final OrderLedger orderLedger;
    private final RequestSignatureVerifier signatureVerifier;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentTransactionService(CheckoutSessionRepository checkoutSessionRepository,
                                     PaymentClaimRepository paymentClaimRepository,
                                     ProductRepository productRepository,
                                     CartRepository cartRepository,
                                     OrderLedger orderLedger,
                                     RequestSignatureVerifier signatureVerifier,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock) {
        this.checkoutSessionRepository = checkoutSessionRepository;
        this.paymentClaimRepository = paymentClaimRepository;
        this.productRepository = productRepository;
        this.cartRepository = cartRepository;
        this.orderLedger = orderLedger;
        this.signatureVerifier = signatureVerifier;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 결제 확인 (PENDING → PAID)
     *
     * 처리 순서:
     * 1. 세션 락 획득 (없으면 CheckoutSessionNotFoundException)
     * 2. 서명 검증 (불일치 시 InvalidSignatureException, 상태 변경 없음)
     * 3. 같은 멱등성 키의 기존 결과가 있으면 그대로 반환
     * 4. 종결 상태면 CheckoutSessionFinalizedException
     * 5. 만료면 CheckoutSessionExpiredException
     * 6. 라인 항목별 원자적 재고 차감 (실패 시 FULFILLMENT_BLOCKED, 전체 롤백)
     * 7. 조건부 전이 PENDING → PAID
     * 8. 주문 기록, 장바구니에서 스냅샷 수량 차감, 원장 기록, 이벤트 발행
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {TransientDataAccessException.class, DuplicateKeyException.class},
            maxAttempts = RetryConstants.PAYMENT_MAX_ATTEMPTS,
            backoff = @Backoff(
                    delay = RetryConstants.PAYMENT_INITIAL_DELAY_MS,
                    multiplier = RetryConstants.PAYMENT_BACKOFF_MULTIPLIER,
                    maxDelay = RetryConstants.PAYMENT_MAX_DELAY_MS,
                    random = true
            )
    )
    public PaymentResult confirm(ConfirmPaymentCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        String sessionId = command.getCheckoutSessionId();

        CheckoutSession session = lockSession(sessionId);
        signatureVerifier.verify(session, command.getRequestSignature());

        Optional<PaymentClaim> prior = paymentClaimRepository.findBySessionAndKey(sessionId, command.getIdempotencyKey());
        if (prior.isPresent()) {
            log.info("결제 확인 재전송, 기존 결과 반환: sessionId={}, key={}, orderId={}",
                    sessionId, command.getIdempotencyKey(), prior.get().getOrderId());
            return PaymentResult.replayed(prior.get());
        }

        if (session.getStatus().isTerminal()) {
            throw new CheckoutSessionFinalizedException(sessionId, session.getStatus());
        }
        if (session.getStatus() == CheckoutStatus.EXPIRED || session.isPastExpiry(now)) {
            throw new CheckoutSessionExpiredException(sessionId);
        }

        decrementInventory(session, now);

        if (!checkoutSessionRepository.markPaidIfPending(sessionId, now)) {
            throw new ConcurrencyFailureException("체크아웃 세션 전이 경합: " + sessionId);
        }

        Order order = orderLedger.recordOrder(Order.completed(session, command.getUtr(), now));
        clearPurchasedItems(session, now);
        paymentClaimRepository.insert(PaymentClaim.record(
                sessionId, command.getIdempotencyKey(), command.getUtr(), CheckoutStatus.PAID, order.getOrderId(), now));
        eventPublisher.publishEvent(OrderRecordedEvent.from(order));

        log.info("결제 확인 완료: sessionId={}, orderId={}, utr={}, total={}",
                sessionId, order.getOrderId(), command.getUtr(), session.getTotalMinorUnits());
        return PaymentResult.executed(order, CheckoutStatus.PAID);
    }

    /**
     * 명시적 결제 실패 (PENDING/EXPIRED → FAILED)
     * 재고와 장바구니는 변경하지 않는다.
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = {TransientDataAccessException.class, DuplicateKeyException.class},
            maxAttempts = RetryConstants.PAYMENT_MAX_ATTEMPTS,
            backoff = @Backoff(
                    delay = RetryConstants.PAYMENT_INITIAL_DELAY_MS,
                    multiplier = RetryConstants.PAYMENT_BACKOFF_MULTIPLIER,
                    maxDelay = RetryConstants.PAYMENT_MAX_DELAY_MS,
                    random = true
            )
    )
    public PaymentResult fail(FailPaymentCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);
        String sessionId = command.getCheckoutSessionId();

        CheckoutSession session = lockSession(sessionId);
        signatureVerifier.verify(session, command.getRequestSignature());

        Optional<PaymentClaim> prior = paymentClaimRepository.findBySessionAndKey(sessionId, command.getIdempotencyKey());
        if (prior.isPresent()) {
            log.info("결제 실패 통지 재전송, 기존 결과 반환: sessionId={}, key={}", sessionId, command.getIdempotencyKey());
            return PaymentResult.replayed(prior.get());
        }

        if (session.getStatus().isTerminal()) {
            throw new CheckoutSessionFinalizedException(sessionId, session.getStatus());
        }

        if (!checkoutSessionRepository.markFailedIfOpen(sessionId, now)) {
            throw new ConcurrencyFailureException("체크아웃 세션 전이 경합: " + sessionId);
        }

        Order order = orderLedger.recordOrder(Order.failed(session, command.getUtr(), command.getReason(), now));
        paymentClaimRepository.insert(PaymentClaim.record(
                sessionId, command.getIdempotencyKey(), command.getUtr(), CheckoutStatus.FAILED, order.getOrderId(), now));
        eventPublisher.publishEvent(OrderRecordedEvent.from(order));

        log.info("결제 실패 처리: sessionId={}, orderId={}, reason={}", sessionId, order.getOrderId(), command.getReason());
        return PaymentResult.executed(order, CheckoutStatus.FAILED);
    }

    private CheckoutSession lockSession(String sessionId) {
        return checkoutSessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> new CheckoutSessionNotFoundException(sessionId));
    }

    /**
     * productId 오름차순으로 차감하여 세션 간 데드락 순환을 방지
     */
    private void decrementInventory(CheckoutSession session, LocalDateTime now) {
        List<CheckoutLineItem> ordered = session.getLineItems().stream()
                .sorted(Comparator.comparing(CheckoutLineItem::getProductId))
                .collect(Collectors.toList());

        for (CheckoutLineItem line : ordered) {
            if (!productRepository.decrementInventory(line.getProductId(), line.getQuantity(), now)) {
                log.warn("결제 확인 중 재고 부족, 세션 PENDING 유지: sessionId={}, productId={}, quantity={}",
                        session.getId(), line.getProductId(), line.getQuantity());
                throw InsufficientInventoryException.fulfillmentBlocked(line.getProductId(), line.getQuantity());
            }
        }
    }

    /**
     * 장바구니에서 스냅샷에 포함된 수량만큼만 차감 (체크아웃 이후 추가된 항목/수량은 유지)
     */
    private void clearPurchasedItems(CheckoutSession session, LocalDateTime now) {
        if (cartRepository.findByBuyerIdForUpdate(session.getBuyerId()).isEmpty()) {
            return;
        }

        Map<String, Integer> purchased = session.getLineItems().stream()
                .collect(Collectors.toMap(CheckoutLineItem::getProductId, CheckoutLineItem::getQuantity, Integer::sum));

        for (CartItem item : cartRepository.findItems(session.getBuyerId(), purchased.keySet())) {
            int remaining = item.getQuantity() - purchased.get(item.getProductId());
            if (remaining > 0) {
                item.changeQuantity(remaining, now);
                cartRepository.saveItem(item);
            } else {
                cartRepository.deleteItem(item);
            }
        }
    }
}
