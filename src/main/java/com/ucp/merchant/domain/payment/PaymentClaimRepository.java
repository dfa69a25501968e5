package com.ucp.merchant.domain.payment;

import java.util.Optional;

/**
 * PaymentClaim Repository Interface (Domain Layer - Port)
 */
public interface PaymentClaimRepository {

    Optional<PaymentClaim> findBySessionAndKey(String checkoutSessionId, String idempotencyKey);

    /**
     * 원장에 기록 (즉시 flush)
     * 동일 (세션, 키)가 이미 존재하면 DuplicateKeyException이 전파되며,
     * 재시도 시 findBySessionAndKey로 기존 결과가 반환된다.
     */
    PaymentClaim insert(PaymentClaim claim);
}
