package com.ucp.merchant.presentation.checkout.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 체크아웃 세션 응답 DTO
 *
 * total은 paise 단위 정수, total_amount는 루피 표기 문자열 (예: "1000.00")
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutSessionResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("buyer_id")
    private String buyerId;

    private String status;

    @JsonProperty("line_items")
    private List<CheckoutLineItemResponse> lineItems;

    private Long total;

    @JsonProperty("total_amount")
    private String totalAmount;

    private String currency;

    private Payment payment;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss'Z'")
    @JsonProperty("expires_at")
    private LocalDateTime expiresAt;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Payment {

        @JsonProperty("handler_id")
        private String handlerId;

        @JsonProperty("payment_link")
        private String paymentLink;

        /** base64 PNG */
        @JsonProperty("qr_code")
        private String qrCode;
    }
}
