package com.ucp.merchant.infrastructure.persistence.payment;

import com.ucp.merchant.domain.payment.PaymentClaim;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

/**
 * PaymentClaim JPA Repository
 */
public interface PaymentClaimJpaRepository extends JpaRepository<PaymentClaim, Long> {

    Optional<PaymentClaim> findByCheckoutSessionIdAndIdempotencyKey(String checkoutSessionId, String idempotencyKey);

    long countByCheckoutSessionId(String checkoutSessionId);
}
