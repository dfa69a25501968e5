package com.ucp.merchant.infrastructure.persistence.checkout;

import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * CheckoutSession JPA Repository
 *
 * 상태 전이는 모두 조건부 UPDATE로 수행한다.
 * 두 결제 확인이 경합해도 WHERE 조건을 만족하는 쪽은 하나뿐이다.
 */
public interface CheckoutSessionJpaRepository extends JpaRepository<CheckoutSession, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM CheckoutSession s WHERE s.id = :id")
    Optional<CheckoutSession> findByIdForUpdate(@Param("id") String id);

    Optional<CheckoutSession> findByBuyerIdAndCreationKey(String buyerId, String creationKey);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE CheckoutSession s SET s.status = :to, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.status = :from AND s.expiresAt > :now")
    int transitionBeforeExpiry(@Param("id") String id,
                               @Param("from") CheckoutStatus from,
                               @Param("to") CheckoutStatus to,
                               @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE CheckoutSession s SET s.status = :to, s.updatedAt = :now " +
           "WHERE s.id = :id AND s.status IN :from")
    int transition(@Param("id") String id,
                   @Param("from") Collection<CheckoutStatus> from,
                   @Param("to") CheckoutStatus to,
                   @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE CheckoutSession s SET s.status = :to, s.updatedAt = :now " +
           "WHERE s.status = :from AND s.expiresAt <= :now")
    int transitionExpired(@Param("from") CheckoutStatus from,
                          @Param("to") CheckoutStatus to,
                          @Param("now") LocalDateTime now);
}
