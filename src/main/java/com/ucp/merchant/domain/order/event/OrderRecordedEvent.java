package com.ucp.merchant.domain.order.event;

import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 주문 원장 기록 이벤트
 *
 * 결제 확인/실패 트랜잭션 커밋 후 리스너에서 로깅 및 Kafka 발행에 사용된다.
 */
@Getter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class OrderRecordedEvent {

    private String orderId;
    private String checkoutSessionId;
    private String buyerId;
    private OrderStatus status;
    private String utr;
    private Long totalMinorUnits;
    private String failureReason;
    private LocalDateTime occurredAt;

    public static OrderRecordedEvent from(Order order) {
        return new OrderRecordedEvent(
                order.getOrderId(),
                order.getCheckoutSessionId(),
                order.getBuyerId(),
                order.getStatus(),
                order.getUtr(),
                order.getTotalMinorUnits(),
                order.getFailureReason(),
                order.getCompletedAt()
        );
    }
}
