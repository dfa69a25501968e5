package com.ucp.merchant.presentation.webhook.request;

/**
 * 파트너 결제 웹훅 이벤트 종류
 */
public enum PaymentEventType {
    PAYMENT_SUCCEEDED,
    PAYMENT_FAILED
}
