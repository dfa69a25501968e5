package com.ucp.merchant.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 주문 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("order_id")
    private String orderId;

    @JsonProperty("checkout_session_id")
    private String checkoutSessionId;

    @JsonProperty("buyer_id")
    private String buyerId;

    private String status;

    private String utr;

    private Long total;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("failure_reason")
    private String failureReason;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    public static OrderResponse from(Order order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .checkoutSessionId(order.getCheckoutSessionId())
                .buyerId(order.getBuyerId())
                .status(order.getStatus().name().toLowerCase(Locale.ROOT))
                .utr(order.getUtr())
                .total(order.getTotalMinorUnits())
                .failureReason(order.getFailureReason())
                .completedAt(order.getCompletedAt())
                .build();
    }
}
