package com.ucp.merchant.domain.cart;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 *
 * 구매자 단위 직렬화:
 * - 모든 변경 작업은 findByBuyerIdForUpdate로 장바구니 행을 먼저 잠근 뒤 수행한다.
 */
public interface CartRepository {

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 장바구니 행 조회
     */
    Optional<Cart> findByBuyerIdForUpdate(String buyerId);

    /**
     * 장바구니 행 저장 (즉시 flush)
     * 동시 최초 생성 시 PK 충돌은 DataIntegrityViolationException으로 전파된다.
     */
    Cart save(Cart cart);

    List<CartItem> findItems(String buyerId);

    List<CartItem> findItems(String buyerId, Collection<String> productIds);

    Optional<CartItem> findItem(String buyerId, String productId);

    CartItem saveItem(CartItem cartItem);

    void deleteItem(CartItem cartItem);
}
