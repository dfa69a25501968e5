package com.ucp.merchant.infrastructure.persistence.checkout;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutSessionRepository;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import com.ucp.merchant.infrastructure.persistence.UniqueKeyViolations;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;

/**
 * MySQL 기반 CheckoutSession Repository 구현
 */
@Repository
@Primary
public class MySQLCheckoutSessionRepository implements CheckoutSessionRepository {

    private final CheckoutSessionJpaRepository checkoutSessionJpaRepository;

    public MySQLCheckoutSessionRepository(CheckoutSessionJpaRepository checkoutSessionJpaRepository) {
        this.checkoutSessionJpaRepository = checkoutSessionJpaRepository;
    }

    @Override
    public CheckoutSession save(CheckoutSession session) {
        try {
            return checkoutSessionJpaRepository.saveAndFlush(session);
        } catch (DataIntegrityViolationException e) {
            throw UniqueKeyViolations.classify(e);
        }
    }

    @Override
    public Optional<CheckoutSession> findById(String checkoutSessionId) {
        return checkoutSessionJpaRepository.findById(checkoutSessionId);
    }

    @Override
    public Optional<CheckoutSession> findByIdForUpdate(String checkoutSessionId) {
        return checkoutSessionJpaRepository.findByIdForUpdate(checkoutSessionId);
    }

    @Override
    public Optional<CheckoutSession> findByBuyerIdAndCreationKey(String buyerId, String creationKey) {
        return checkoutSessionJpaRepository.findByBuyerIdAndCreationKey(buyerId, creationKey);
    }

    @Override
    public boolean markPaidIfPending(String checkoutSessionId, LocalDateTime now) {
        return checkoutSessionJpaRepository.transitionBeforeExpiry(
                checkoutSessionId, CheckoutStatus.PENDING, CheckoutStatus.PAID, now) == 1;
    }

    @Override
    public boolean markFailedIfOpen(String checkoutSessionId, LocalDateTime now) {
        return checkoutSessionJpaRepository.transition(
                checkoutSessionId,
                EnumSet.of(CheckoutStatus.PENDING, CheckoutStatus.EXPIRED),
                CheckoutStatus.FAILED,
                now) == 1;
    }

    @Override
    public int markExpiredBefore(LocalDateTime now) {
        return checkoutSessionJpaRepository.transitionExpired(CheckoutStatus.PENDING, CheckoutStatus.EXPIRED, now);
    }
}
