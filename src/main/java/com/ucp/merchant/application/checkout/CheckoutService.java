package com.ucp.merchant.application.checkout;

import com.ucp.merchant.application.checkout.dto.CheckoutSessionResult;
import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.cart.CartItem;
import com.ucp.merchant.domain.cart.CartRepository;
import com.ucp.merchant.domain.checkout.CheckoutLineItem;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutSessionNotFoundException;
import com.ucp.merchant.domain.checkout.CheckoutSessionRepository;
import com.ucp.merchant.domain.checkout.EmptyCartException;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.domain.product.Product;
import com.ucp.merchant.domain.product.ProductNotFoundException;
import com.ucp.merchant.domain.product.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CheckoutService - Checkout Session Machine (Application 계층)
 *
 * 역할:
 * - 장바구니를 고정 견적(CheckoutSession)으로 변환
 * - UPI 딥링크/QR 생성, PENDING 상태로 저장
 * - 세션 조회 시 만료 판정 반영
 *
 * 비즈니스 규칙:
 * - 빈 장바구니 → EmptyCartException
 * - 한 품목이라도 재고 부족 → InsufficientInventoryException, 세션 생성 없음 (all-or-nothing)
 * - 장바구니는 변경하지 않음 (장바구니 비우기는 결제 확정 시에만)
 * - 같은 (구매자, Idempotency-Key)로 재요청하면 이미 생성된 세션 반환
 */
@Service
public class CheckoutService {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final CheckoutSessionRepository checkoutSessionRepository;
    private final UpiPaymentLinkGenerator paymentLinkGenerator;
    private final QrCodeGenerator qrCodeGenerator;
    private final UcpProperties properties;
    private final Clock clock;

    public CheckoutService(CartRepository cartRepository,
                           ProductRepository productRepository,
                           CheckoutSessionRepository checkoutSessionRepository,
                           UpiPaymentLinkGenerator paymentLinkGenerator,
                           QrCodeGenerator qrCodeGenerator,
                           UcpProperties properties,
                           Clock clock) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.checkoutSessionRepository = checkoutSessionRepository;
        this.paymentLinkGenerator = paymentLinkGenerator;
        this.qrCodeGenerator = qrCodeGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 체크아웃 세션 생성
     *
     * 구매자 장바구니 행을 잠가 장바구니 변경과 직렬화한 상태에서 스냅샷을 만든다.
     *
     * @param creationKey Idempotency-Key (null 허용)
     */
    @Transactional(rollbackFor = Exception.class)
    public CheckoutSessionResult createCheckoutSession(String buyerId, String creationKey) {
        LocalDateTime now = LocalDateTime.now(clock);

        if (cartRepository.findByBuyerIdForUpdate(buyerId).isEmpty()) {
            throw new EmptyCartException(buyerId);
        }

        if (creationKey != null) {
            Optional<CheckoutSession> existing = checkoutSessionRepository.findByBuyerIdAndCreationKey(buyerId, creationKey);
            if (existing.isPresent()) {
                log.info("체크아웃 생성 재요청, 기존 세션 반환: buyerId={}, sessionId={}", buyerId, existing.get().getId());
                return toResult(existing.get(), now);
            }
        }

        List<CartItem> cartItems = cartRepository.findItems(buyerId);
        if (cartItems.isEmpty()) {
            throw new EmptyCartException(buyerId);
        }

        List<CheckoutLineItem> lineItems = new ArrayList<>();
        for (CartItem item : cartItems) {
            Product product = productRepository.findById(item.getProductId())
                    .orElseThrow(() -> new ProductNotFoundException(item.getProductId()));
            if (!product.hasInventoryFor(item.getQuantity())) {
                throw new InsufficientInventoryException(product.getProductId(), item.getQuantity());
            }
            lineItems.add(CheckoutLineItem.snapshot(
                    product.getProductId(), product.getTitle(), item.getQuantity(), product.getPrice()));
        }

        String sessionId = CheckoutSession.newId();
        long total = lineItems.stream().mapToLong(CheckoutLineItem::getSubtotal).sum();
        String paymentLink = paymentLinkGenerator.generate(total, sessionId);
        LocalDateTime expiresAt = now.plus(properties.getCheckout().getSessionTtl());

        CheckoutSession session = checkoutSessionRepository.save(
                CheckoutSession.open(sessionId, buyerId, creationKey, lineItems, paymentLink, now, expiresAt));

        log.info("체크아웃 세션 생성: sessionId={}, buyerId={}, total={}, lines={}, expiresAt={}",
                session.getId(), buyerId, session.getTotalMinorUnits(), lineItems.size(), expiresAt);
        return toResult(session, now);
    }

    @Transactional(readOnly = true)
    public CheckoutSessionResult getCheckoutSession(String checkoutSessionId) {
        CheckoutSession session = checkoutSessionRepository.findById(checkoutSessionId)
                .orElseThrow(() -> new CheckoutSessionNotFoundException(checkoutSessionId));
        return toResult(session, LocalDateTime.now(clock));
    }

    /**
     * 만료 시각이 지난 PENDING 세션을 EXPIRED로 전환 (정리 작업용)
     * 주문은 생성하지 않는다.
     */
    @Transactional(rollbackFor = Exception.class)
    public int expireStaleSessions() {
        return checkoutSessionRepository.markExpiredBefore(LocalDateTime.now(clock));
    }

    private CheckoutSessionResult toResult(CheckoutSession session, LocalDateTime now) {
        return new CheckoutSessionResult(
                session,
                session.effectiveStatus(now),
                qrCodeGenerator.toBase64Png(session.getPaymentLink()));
    }
}
