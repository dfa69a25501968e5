package com.ucp.merchant.domain.payment;

import com.ucp.merchant.domain.checkout.CheckoutStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * PaymentClaim - 멱등성 키 원장 엔티티
 *
 * 역할:
 * - (checkoutSessionId, idempotencyKey) 당 최대 한 번의 실행을 보장
 * - 최초 실행 결과(세션 최종 상태, 주문 ID)를 저장하여 재전송 시 그대로 반환
 *
 * 비즈니스 규칙:
 * - UNIQUE(checkout_session_id, idempotency_key)로 insert-if-absent 보장
 * - 종결 결과(PAID/FAILED)만 기록한다. 서명 불일치나 재고 경합으로 실패한 요청은
 *   기록하지 않으므로 같은 키로 재시도할 수 있다.
 */
@Entity
@Table(name = "payment_claims", uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_claims_session_key", columnNames = {"checkout_session_id", "idempotency_key"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentClaim {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_claim_id")
    private Long paymentClaimId;

    @Column(name = "checkout_session_id", nullable = false, length = 64)
    private String checkoutSessionId;

    @Column(name = "idempotency_key", nullable = false, length = 255)
    private String idempotencyKey;

    @Column(name = "utr", length = 64)
    private String utr;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private CheckoutStatus outcome;

    @Column(name = "order_id", nullable = false, length = 64)
    private String orderId;

    @Column(name = "received_at", nullable = false, updatable = false)
    private LocalDateTime receivedAt;

    public static PaymentClaim record(String checkoutSessionId, String idempotencyKey, String utr,
                                      CheckoutStatus outcome, String orderId, LocalDateTime receivedAt) {
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("멱등성 원장에는 종결 결과만 기록할 수 있습니다: " + outcome);
        }
        return PaymentClaim.builder()
                .checkoutSessionId(checkoutSessionId)
                .idempotencyKey(idempotencyKey)
                .utr(utr)
                .outcome(outcome)
                .orderId(orderId)
                .receivedAt(receivedAt)
                .build();
    }
}
