package com.ucp.merchant.domain.checkout;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * CheckoutSession Repository Interface (Domain Layer - Port)
 *
 * 상태 전이 메서드는 모두 단일 조건부 UPDATE이며,
 * 갱신된 행이 없으면 false를 반환한다 (다른 작성자가 먼저 커밋함).
 */
public interface CheckoutSessionRepository {

    CheckoutSession save(CheckoutSession session);

    Optional<CheckoutSession> findById(String checkoutSessionId);

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 세션 조회
     * 동일 세션에 대한 결제 확인을 직렬화한다.
     */
    Optional<CheckoutSession> findByIdForUpdate(String checkoutSessionId);

    Optional<CheckoutSession> findByBuyerIdAndCreationKey(String buyerId, String creationKey);

    /**
     * PENDING → PAID (WHERE status = 'PENDING' AND expires_at > :now)
     */
    boolean markPaidIfPending(String checkoutSessionId, LocalDateTime now);

    /**
     * PENDING/EXPIRED → FAILED
     */
    boolean markFailedIfOpen(String checkoutSessionId, LocalDateTime now);

    /**
     * 만료 시각이 지난 PENDING 세션을 EXPIRED로 일괄 전환
     *
     * @return 전환된 세션 수
     */
    int markExpiredBefore(LocalDateTime now);
}
