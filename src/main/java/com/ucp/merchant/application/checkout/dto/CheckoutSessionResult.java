package com.ucp.merchant.application.checkout.dto;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체크아웃 세션 조회/생성 결과
 * status는 조회 시점의 실효 상태 (만료 판정 반영), qrImageBase64는 결제 링크로부터 파생
 */
@Getter
@AllArgsConstructor
public class CheckoutSessionResult {
    private CheckoutSession session;
    private CheckoutStatus status;
    private String qrImageBase64;
}
