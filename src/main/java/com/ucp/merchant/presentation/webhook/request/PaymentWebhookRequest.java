package com.ucp.merchant.presentation.webhook.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 파트너 결제 웹훅 요청 DTO
 *
 * PAYMENT_SUCCEEDED는 utr 필수, PAYMENT_FAILED의 reason은 생략 시 PAYMENT_DECLINED
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentWebhookRequest {

    @NotNull(message = "event_type은 필수입니다")
    @JsonProperty("event_type")
    private PaymentEventType eventType;

    @NotBlank(message = "checkout_session_id는 필수입니다")
    @JsonProperty("checkout_session_id")
    private String checkoutSessionId;

    @Size(max = 64, message = "utr은 64자 이하여야 합니다")
    private String utr;

    @Size(max = 255, message = "reason은 255자 이하여야 합니다")
    private String reason;
}
