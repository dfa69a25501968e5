package com.ucp.merchant.presentation.checkout.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 완료 요청 DTO (구매자가 입력한 UPI 거래 참조번호)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletePaymentRequest {

    @NotBlank(message = "utr은 필수입니다")
    @Size(max = 64, message = "utr은 64자 이하여야 합니다")
    private String utr;
}
