package com.ucp.merchant.application.payment.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 결제 확인 명령 (UTR 클레임)
 */
@Getter
@ToString(exclude = "requestSignature")
@AllArgsConstructor
public class ConfirmPaymentCommand {
    private String checkoutSessionId;
    private String utr;
    private String idempotencyKey;
    private String requestSignature;
}
