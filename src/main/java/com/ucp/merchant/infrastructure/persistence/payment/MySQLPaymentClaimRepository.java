package com.ucp.merchant.infrastructure.persistence.payment;

import com.ucp.merchant.domain.payment.PaymentClaim;
import com.ucp.merchant.domain.payment.PaymentClaimRepository;
import com.ucp.merchant.infrastructure.persistence.UniqueKeyViolations;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * MySQL 기반 멱등성 원장 구현
 */
@Repository
@Primary
public class MySQLPaymentClaimRepository implements PaymentClaimRepository {

    private final PaymentClaimJpaRepository paymentClaimJpaRepository;

    public MySQLPaymentClaimRepository(PaymentClaimJpaRepository paymentClaimJpaRepository) {
        this.paymentClaimJpaRepository = paymentClaimJpaRepository;
    }

    @Override
    public Optional<PaymentClaim> findBySessionAndKey(String checkoutSessionId, String idempotencyKey) {
        return paymentClaimJpaRepository.findByCheckoutSessionIdAndIdempotencyKey(checkoutSessionId, idempotencyKey);
    }

    /**
     * UNIQUE 제약 위반을 커밋 전에 드러내기 위해 즉시 flush
     */
    @Override
    public PaymentClaim insert(PaymentClaim claim) {
        try {
            return paymentClaimJpaRepository.saveAndFlush(claim);
        } catch (DataIntegrityViolationException e) {
            throw UniqueKeyViolations.classify(e);
        }
    }
}
