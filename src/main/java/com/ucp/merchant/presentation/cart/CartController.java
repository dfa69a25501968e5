package com.ucp.merchant.presentation.cart;

import com.ucp.merchant.application.cart.CartService;
import com.ucp.merchant.presentation.cart.mapper.CartMapper;
import com.ucp.merchant.presentation.cart.request.AddCartItemRequest;
import com.ucp.merchant.presentation.cart.request.UpdateQuantityRequest;
import com.ucp.merchant.presentation.cart.response.CartResponse;
import com.ucp.merchant.presentation.common.UcpHeaders;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CartController - Presentation 계층
 * 장바구니 API 요청 처리. 모든 응답은 변경 후의 장바구니 전체.
 */
@RestController
@RequestMapping("/carts")
public class CartController {

    private final CartService cartService;
    private final CartMapper cartMapper;

    public CartController(CartService cartService, CartMapper cartMapper) {
        this.cartService = cartService;
        this.cartMapper = cartMapper;
    }

    /**
     * GET /carts - 장바구니 조회
     */
    @GetMapping
    public ResponseEntity<CartResponse> getCart(@RequestHeader(UcpHeaders.BUYER_ID) String buyerId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.viewCart(buyerId)));
    }

    /**
     * POST /carts/items - 장바구니 아이템 추가 (같은 상품이면 수량 누적)
     */
    @PostMapping("/items")
    public ResponseEntity<CartResponse> addCartItem(
            @RequestHeader(UcpHeaders.BUYER_ID) String buyerId,
            @Valid @RequestBody AddCartItemRequest request) {
        return ResponseEntity.ok(cartMapper.toCartResponse(
                cartService.addItem(buyerId, cartMapper.toAddCartItemCommand(request))));
    }

    /**
     * PUT /carts/items/{product_id} - 장바구니 아이템 수량 수정
     */
    @PutMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> updateCartItemQuantity(
            @RequestHeader(UcpHeaders.BUYER_ID) String buyerId,
            @PathVariable("product_id") String productId,
            @Valid @RequestBody UpdateQuantityRequest request) {
        return ResponseEntity.ok(cartMapper.toCartResponse(
                cartService.updateItem(buyerId, cartMapper.toUpdateCartItemCommand(productId, request))));
    }

    /**
     * DELETE /carts/items/{product_id} - 장바구니 아이템 제거 (없으면 변경 없음)
     */
    @DeleteMapping("/items/{product_id}")
    public ResponseEntity<CartResponse> removeCartItem(
            @RequestHeader(UcpHeaders.BUYER_ID) String buyerId,
            @PathVariable("product_id") String productId) {
        return ResponseEntity.ok(cartMapper.toCartResponse(cartService.removeItem(buyerId, productId)));
    }
}
