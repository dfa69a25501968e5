package com.ucp.merchant.infrastructure.persistence.cart;

import com.ucp.merchant.domain.cart.Cart;
import com.ucp.merchant.domain.cart.CartItem;
import com.ucp.merchant.domain.cart.CartRepository;
import com.ucp.merchant.infrastructure.persistence.UniqueKeyViolations;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Cart Repository 구현
 */
@Repository
@Primary
public class MySQLCartRepository implements CartRepository {

    private final CartJpaRepository cartJpaRepository;
    private final CartItemJpaRepository cartItemJpaRepository;

    public MySQLCartRepository(CartJpaRepository cartJpaRepository,
                               CartItemJpaRepository cartItemJpaRepository) {
        this.cartJpaRepository = cartJpaRepository;
        this.cartItemJpaRepository = cartItemJpaRepository;
    }

    @Override
    public Optional<Cart> findByBuyerIdForUpdate(String buyerId) {
        return cartJpaRepository.findByBuyerIdForUpdate(buyerId);
    }

    @Override
    public Cart save(Cart cart) {
        try {
            return cartJpaRepository.saveAndFlush(cart);
        } catch (DataIntegrityViolationException e) {
            throw UniqueKeyViolations.classify(e);
        }
    }

    @Override
    public List<CartItem> findItems(String buyerId) {
        return cartItemJpaRepository.findByBuyerIdOrderByCartItemIdAsc(buyerId);
    }

    @Override
    public List<CartItem> findItems(String buyerId, Collection<String> productIds) {
        if (productIds.isEmpty()) {
            return List.of();
        }
        return cartItemJpaRepository.findByBuyerIdAndProductIdIn(buyerId, productIds);
    }

    @Override
    public Optional<CartItem> findItem(String buyerId, String productId) {
        return cartItemJpaRepository.findByBuyerIdAndProductId(buyerId, productId);
    }

    @Override
    public CartItem saveItem(CartItem cartItem) {
        return cartItemJpaRepository.save(cartItem);
    }

    @Override
    public void deleteItem(CartItem cartItem) {
        cartItemJpaRepository.delete(cartItem);
    }
}
