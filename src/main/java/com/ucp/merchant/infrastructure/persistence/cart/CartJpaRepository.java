package com.ucp.merchant.infrastructure.persistence.cart;

import com.ucp.merchant.domain.cart.Cart;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * Cart JPA Repository
 */
public interface CartJpaRepository extends JpaRepository<Cart, String> {

    /**
     * 구매자 장바구니 행 비관적 락 조회 (SELECT ... FOR UPDATE)
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Cart c WHERE c.buyerId = :buyerId")
    Optional<Cart> findByBuyerIdForUpdate(@Param("buyerId") String buyerId);
}
