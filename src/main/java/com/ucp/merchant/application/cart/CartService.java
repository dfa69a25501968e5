package com.ucp.merchant.application.cart;

import com.ucp.merchant.application.cart.dto.AddCartItemCommand;
import com.ucp.merchant.application.cart.dto.CartLineView;
import com.ucp.merchant.application.cart.dto.CartView;
import com.ucp.merchant.application.cart.dto.UpdateCartItemCommand;
import com.ucp.merchant.domain.cart.Cart;
import com.ucp.merchant.domain.cart.CartConstants;
import com.ucp.merchant.domain.cart.CartItem;
import com.ucp.merchant.domain.cart.CartRepository;
import com.ucp.merchant.domain.cart.InvalidQuantityException;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.domain.product.Product;
import com.ucp.merchant.domain.product.ProductNotFoundException;
import com.ucp.merchant.domain.product.ProductRepository;
import com.ucp.merchant.infrastructure.constants.RetryConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CartService - Cart Manager (Application 계층)
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository, ProductRepository 인터페이스에만 의존 (Port)
 *
 * 동시성:
 * - 변경 작업은 구매자 장바구니 행을 SELECT ... FOR UPDATE로 잠근 뒤 수행 (구매자 단위 직렬화)
 * - 장바구니 행 최초 생성이 경합하면 PK 충돌이 발생하며, @Retryable로 새 트랜잭션에서 재시도
 *
 * 재고 검증:
 * - 담기/수정 시점의 카탈로그 재고로만 검증하며 예약하지 않음
 */
@Service
public class CartService {

    private static final Logger log = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;
    private final Clock clock;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository,
                       Clock clock) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
        this.clock = clock;
    }

    /**
     * 장바구니 조회 (읽기 전용, 상태 변경 없음)
     */
    @Transactional(readOnly = true)
    public CartView viewCart(String buyerId) {
        return buildView(buyerId);
    }

    /**
     * 장바구니에 상품 담기 (기존 라인이 있으면 수량 누적)
     *
     * 비즈니스 규칙:
     * - 수량은 1 이상 1000 이하
     * - 누적 수량이 현재 재고를 넘으면 InsufficientInventoryException (장바구니 변경 없음)
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = DuplicateKeyException.class,
            maxAttempts = RetryConstants.CART_MAX_ATTEMPTS,
            backoff = @Backoff(delay = RetryConstants.CART_INITIAL_DELAY_MS, random = true)
    )
    public CartView addItem(String buyerId, AddCartItemCommand command) {
        validateQuantity(command.getQuantity());
        LocalDateTime now = LocalDateTime.now(clock);

        Cart cart = lockOrCreateCart(buyerId, now);
        Product product = findProduct(command.getProductId());

        Optional<CartItem> existing = cartRepository.findItem(buyerId, product.getProductId());
        int newQuantity = existing.map(CartItem::getQuantity).orElse(0) + command.getQuantity();
        if (newQuantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(newQuantity);
        }
        if (!product.hasInventoryFor(newQuantity)) {
            throw new InsufficientInventoryException(product.getProductId(), newQuantity);
        }

        if (existing.isPresent()) {
            existing.get().changeQuantity(newQuantity, now);
            cartRepository.saveItem(existing.get());
        } else {
            cartRepository.saveItem(CartItem.create(buyerId, product.getProductId(), newQuantity, now));
        }
        cart.touch(now);

        log.info("장바구니 담기: buyerId={}, productId={}, quantity={}", buyerId, product.getProductId(), newQuantity);
        return buildView(buyerId);
    }

    /**
     * 장바구니 라인 수량 변경 (quantity <= 0 이면 removeItem과 동일)
     */
    @Transactional(rollbackFor = Exception.class)
    @Retryable(
            retryFor = DuplicateKeyException.class,
            maxAttempts = RetryConstants.CART_MAX_ATTEMPTS,
            backoff = @Backoff(delay = RetryConstants.CART_INITIAL_DELAY_MS, random = true)
    )
    public CartView updateItem(String buyerId, UpdateCartItemCommand command) {
        Integer quantity = command.getQuantity();
        if (quantity == null || quantity <= 0) {
            return doRemoveItem(buyerId, command.getProductId());
        }
        if (quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Cart cart = lockOrCreateCart(buyerId, now);
        Product product = findProduct(command.getProductId());
        if (!product.hasInventoryFor(quantity)) {
            throw new InsufficientInventoryException(product.getProductId(), quantity);
        }

        Optional<CartItem> existing = cartRepository.findItem(buyerId, product.getProductId());
        if (existing.isPresent()) {
            existing.get().changeQuantity(quantity, now);
            cartRepository.saveItem(existing.get());
        } else {
            cartRepository.saveItem(CartItem.create(buyerId, product.getProductId(), quantity, now));
        }
        cart.touch(now);

        log.info("장바구니 수량 변경: buyerId={}, productId={}, quantity={}", buyerId, product.getProductId(), quantity);
        return buildView(buyerId);
    }

    /**
     * 장바구니 라인 삭제 (없는 항목 삭제는 오류가 아닌 no-op)
     */
    @Transactional(rollbackFor = Exception.class)
    public CartView removeItem(String buyerId, String productId) {
        return doRemoveItem(buyerId, productId);
    }

    private CartView doRemoveItem(String buyerId, String productId) {
        Optional<Cart> cart = cartRepository.findByBuyerIdForUpdate(buyerId);
        if (cart.isPresent()) {
            cartRepository.findItem(buyerId, productId).ifPresent(item -> {
                cartRepository.deleteItem(item);
                log.info("장바구니 항목 삭제: buyerId={}, productId={}", buyerId, productId);
            });
            cart.get().touch(LocalDateTime.now(clock));
        }
        return buildView(buyerId);
    }

    private Cart lockOrCreateCart(String buyerId, LocalDateTime now) {
        return cartRepository.findByBuyerIdForUpdate(buyerId)
                .orElseGet(() -> cartRepository.save(Cart.create(buyerId, now)));
    }

    private Product findProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    private CartView buildView(String buyerId) {
        List<CartLineView> lines = cartRepository.findItems(buyerId).stream()
                .map(item -> productRepository.findById(item.getProductId())
                        .map(product -> CartLineView.builder()
                                .productId(product.getProductId())
                                .title(product.getTitle())
                                .quantity(item.getQuantity())
                                .unitPrice(product.getPrice())
                                .subtotal(product.subtotalFor(item.getQuantity()))
                                .build()))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
        return CartView.of(buyerId, lines);
    }

    private void validateQuantity(Integer quantity) {
        if (quantity == null
                || quantity < CartConstants.MIN_CART_QUANTITY
                || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
