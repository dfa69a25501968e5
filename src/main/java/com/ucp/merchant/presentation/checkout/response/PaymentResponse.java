package com.ucp.merchant.presentation.checkout.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 확인/실패 처리 응답 DTO
 * replayed=true 이면 같은 멱등성 키로 이미 처리된 결과이다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentResponse {

    @JsonProperty("checkout_session_id")
    private String checkoutSessionId;

    @JsonProperty("order_id")
    private String orderId;

    private String status;

    private String utr;

    private boolean replayed;
}
