package com.ucp.merchant.infrastructure.persistence.cart;

import com.ucp.merchant.domain.cart.CartItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CartItem JPA Repository
 */
public interface CartItemJpaRepository extends JpaRepository<CartItem, Long> {

    List<CartItem> findByBuyerIdOrderByCartItemIdAsc(String buyerId);

    List<CartItem> findByBuyerIdAndProductIdIn(String buyerId, Collection<String> productIds);

    Optional<CartItem> findByBuyerIdAndProductId(String buyerId, String productId);
}
