package com.ucp.merchant.presentation.cart.mapper;

import com.ucp.merchant.application.cart.dto.AddCartItemCommand;
import com.ucp.merchant.application.cart.dto.CartLineView;
import com.ucp.merchant.application.cart.dto.CartView;
import com.ucp.merchant.application.cart.dto.UpdateCartItemCommand;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.presentation.cart.request.AddCartItemRequest;
import com.ucp.merchant.presentation.cart.request.UpdateQuantityRequest;
import com.ucp.merchant.presentation.cart.response.CartItemResponse;
import com.ucp.merchant.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * - Request DTO → Application Command
 * - Application CartView → Response DTO
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        return new AddCartItemCommand(request.getProductId(), request.getQuantity());
    }

    /**
     * 경로의 product_id와 요청 본문의 수량을 합쳐 명령 생성
     */
    public UpdateCartItemCommand toUpdateCartItemCommand(String productId, UpdateQuantityRequest request) {
        return new UpdateCartItemCommand(productId, request.getQuantity());
    }

    public CartResponse toCartResponse(CartView view) {
        return CartResponse.builder()
                .buyerId(view.getBuyerId())
                .items(view.getItems().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .totalItems(view.getTotalItems())
                .totalPrice(view.getTotalMinorUnits())
                .currency(CheckoutSession.CURRENCY_INR)
                .build();
    }

    private CartItemResponse toCartItemResponse(CartLineView line) {
        return CartItemResponse.builder()
                .productId(line.getProductId())
                .title(line.getTitle())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .subtotal(line.getSubtotal())
                .build();
    }
}
