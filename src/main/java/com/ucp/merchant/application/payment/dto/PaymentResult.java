package com.ucp.merchant.application.payment.dto;

import com.ucp.merchant.domain.checkout.CheckoutStatus;
import com.ucp.merchant.domain.order.Order;
import com.ucp.merchant.domain.payment.PaymentClaim;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 확인/실패 처리 결과
 *
 * replayed=true 이면 같은 멱등성 키로 이미 처리된 결과를 그대로 돌려준 것이다.
 */
@Getter
@AllArgsConstructor
public class PaymentResult {
    private String checkoutSessionId;
    private String orderId;
    private CheckoutStatus sessionStatus;
    private String utr;
    private boolean replayed;

    public static PaymentResult executed(Order order, CheckoutStatus sessionStatus) {
        return new PaymentResult(order.getCheckoutSessionId(), order.getOrderId(), sessionStatus, order.getUtr(), false);
    }

    public static PaymentResult replayed(PaymentClaim claim) {
        return new PaymentResult(claim.getCheckoutSessionId(), claim.getOrderId(), claim.getOutcome(), claim.getUtr(), true);
    }
}
