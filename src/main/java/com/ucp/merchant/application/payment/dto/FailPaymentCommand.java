package com.ucp.merchant.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 명시적 결제 실패 명령 (실패 웹훅, 구매자 취소)
 * utr은 없을 수 있다.
 */
@Getter
@ToString(exclude = "requestSignature")
@AllArgsConstructor
public class FailPaymentCommand {

    public static final String REASON_CANCELED_BY_BUYER = "CANCELED_BY_BUYER";
    public static final String REASON_PAYMENT_DECLINED = "PAYMENT_DECLINED";

    private String checkoutSessionId;
    private String utr;
    private String idempotencyKey;
    private String requestSignature;
    private String reason;
}
