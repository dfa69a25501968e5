package com.ucp.merchant.domain.order;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Order 도메인 엔티티 (추가 전용 원장 레코드)
 *
 * 비즈니스 규칙:
 * - 체크아웃 세션과 1:1 (UNIQUE checkout_session_id)
 * - 세션의 종결 전이 시점에 정확히 한 번 생성되며 이후 변경되지 않음
 */
@Entity
@Table(name = "orders", uniqueConstraints = {
        @UniqueConstraint(name = "uk_orders_checkout_session", columnNames = {"checkout_session_id"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {

    public static final String ID_PREFIX = "ord_";

    @Id
    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "checkout_session_id", nullable = false, length = 64)
    private String checkoutSessionId;

    @Column(name = "buyer_id", nullable = false, length = 128)
    private String buyerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OrderStatus status;

    @Column(name = "utr", length = 64)
    private String utr;

    @Column(name = "total_minor_units", nullable = false)
    private Long totalMinorUnits;

    @Column(name = "failure_reason", length = 255)
    private String failureReason;

    @Column(name = "completed_at", nullable = false, updatable = false)
    private LocalDateTime completedAt;

    /**
     * 결제 확인 성공 주문
     */
    public static Order completed(CheckoutSession session, String utr, LocalDateTime now) {
        return base(session, utr, now)
                .status(OrderStatus.COMPLETED)
                .build();
    }

    /**
     * 명시적 결제 실패(또는 구매자 취소) 주문
     */
    public static Order failed(CheckoutSession session, String utr, String failureReason, LocalDateTime now) {
        return base(session, utr, now)
                .status(OrderStatus.FAILED)
                .failureReason(failureReason)
                .build();
    }

    private static OrderBuilder base(CheckoutSession session, String utr, LocalDateTime now) {
        return Order.builder()
                .orderId(ID_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .checkoutSessionId(session.getId())
                .buyerId(session.getBuyerId())
                .utr(utr)
                .totalMinorUnits(session.getTotalMinorUnits())
                .completedAt(now);
    }
}
