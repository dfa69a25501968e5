package com.ucp.merchant.presentation.cart;

import com.ucp.merchant.application.cart.CartService;
import com.ucp.merchant.application.cart.dto.AddCartItemCommand;
import com.ucp.merchant.application.cart.dto.CartLineView;
import com.ucp.merchant.application.cart.dto.CartView;
import com.ucp.merchant.application.cart.dto.UpdateCartItemCommand;
import com.ucp.merchant.domain.cart.InvalidQuantityException;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.domain.product.ProductNotFoundException;
import com.ucp.merchant.presentation.cart.mapper.CartMapper;
import com.ucp.merchant.presentation.common.GlobalExceptionHandler;
import com.ucp.merchant.presentation.common.UcpHeaderInterceptor;
import com.ucp.merchant.presentation.common.UcpHeaders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * CartControllerTest - Presentation Layer Unit Test
 *
 * 테스트 대상: CartController
 * - GET /carts
 * - POST /carts/items
 * - PUT /carts/items/{product_id}
 * - DELETE /carts/items/{product_id}
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CartController 단위 테스트")
class CartControllerTest {

    private static final String BUYER_ID = "buyer-1";

    private MockMvc mockMvc;

    @Mock
    private CartService cartService;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(new CartController(cartService, new CartMapper()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(new UcpHeaderInterceptor())
                .build();
    }

    private CartView cartWith(int quantity) {
        CartLineView line = CartLineView.builder()
                .productId("p1").title("Brass Diya").quantity(quantity)
                .unitPrice(50000L).subtotal(50000L * quantity)
                .build();
        return CartView.of(BUYER_ID, List.of(line));
    }

    private MockHttpServletRequestBuilder withProtocolHeaders(MockHttpServletRequestBuilder builder) {
        return builder.header(UcpHeaders.BUYER_ID, BUYER_ID)
                .header(UcpHeaders.AGENT, "test-agent/1.0")
                .header(UcpHeaders.IDEMPOTENCY_KEY, "key-1")
                .header(UcpHeaders.REQUEST_ID, "req-1");
    }

    @Test
    @DisplayName("장바구니 조회 - 라인과 합계 반환")
    void testGetCart() throws Exception {
        // Given
        when(cartService.viewCart(BUYER_ID)).thenReturn(cartWith(2));

        // When & Then
        mockMvc.perform(get("/carts").header(UcpHeaders.BUYER_ID, BUYER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.buyer_id").value(BUYER_ID))
                .andExpect(jsonPath("$.items[0].product_id").value("p1"))
                .andExpect(jsonPath("$.items[0].unit_price").value(50000))
                .andExpect(jsonPath("$.items[0].subtotal").value(100000))
                .andExpect(jsonPath("$.total_items").value(2))
                .andExpect(jsonPath("$.total_price").value(100000))
                .andExpect(jsonPath("$.currency").value("INR"));
    }

    @Test
    @DisplayName("장바구니 조회 - X-BUYER-ID 누락 → 400")
    void testGetCart_MissingBuyer() throws Exception {
        mockMvc.perform(get("/carts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("PROTOCOL_MISSING_REQUIRED_HEADER"));

        verifyNoInteractions(cartService);
    }

    @Test
    @DisplayName("상품 담기 - 명령 변환 후 변경된 장바구니 반환")
    void testAddCartItem() throws Exception {
        // Given
        when(cartService.addItem(eq(BUYER_ID), any(AddCartItemCommand.class))).thenReturn(cartWith(2));

        // When
        mockMvc.perform(withProtocolHeaders(post("/carts/items"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"p1\",\"quantity\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_items").value(2));

        // Then
        ArgumentCaptor<AddCartItemCommand> captor = ArgumentCaptor.forClass(AddCartItemCommand.class);
        verify(cartService).addItem(eq(BUYER_ID), captor.capture());
        assertEquals("p1", captor.getValue().getProductId());
        assertEquals(2, captor.getValue().getQuantity());
    }

    @Test
    @DisplayName("상품 담기 - product_id 누락 → 400 PROTOCOL_VALIDATION_ERROR")
    void testAddCartItem_MissingProductId() throws Exception {
        mockMvc.perform(withProtocolHeaders(post("/carts/items"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("PROTOCOL_VALIDATION_ERROR"));

        verifyNoInteractions(cartService);
    }

    @Test
    @DisplayName("상품 담기 - Idempotency-Key 누락 → 400")
    void testAddCartItem_MissingIdempotencyKey() throws Exception {
        mockMvc.perform(post("/carts/items")
                        .header(UcpHeaders.BUYER_ID, BUYER_ID)
                        .header(UcpHeaders.AGENT, "test-agent/1.0")
                        .header(UcpHeaders.REQUEST_ID, "req-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"p1\",\"quantity\":2}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("PROTOCOL_MISSING_REQUIRED_HEADER"));
    }

    @Test
    @DisplayName("상품 담기 - 존재하지 않는 상품 → 404")
    void testAddCartItem_ProductNotFound() throws Exception {
        when(cartService.addItem(eq(BUYER_ID), any(AddCartItemCommand.class)))
                .thenThrow(new ProductNotFoundException("nope"));

        mockMvc.perform(withProtocolHeaders(post("/carts/items"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"nope\",\"quantity\":1}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_NOT_FOUND"));
    }

    @Test
    @DisplayName("상품 담기 - 재고 초과 → 409, retryable=false")
    void testAddCartItem_InsufficientInventory() throws Exception {
        when(cartService.addItem(eq(BUYER_ID), any(AddCartItemCommand.class)))
                .thenThrow(new InsufficientInventoryException("p1", 99));

        mockMvc.perform(withProtocolHeaders(post("/carts/items"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"p1\",\"quantity\":99}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_INSUFFICIENT_INVENTORY"))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("상품 담기 - 수량 범위 위반 → 400")
    void testAddCartItem_InvalidQuantity() throws Exception {
        when(cartService.addItem(eq(BUYER_ID), any(AddCartItemCommand.class)))
                .thenThrow(new InvalidQuantityException(0));

        mockMvc.perform(withProtocolHeaders(post("/carts/items"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_id\":\"p1\",\"quantity\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_CART_INVALID_QUANTITY"));
    }

    @Test
    @DisplayName("수량 변경 - 경로의 product_id 사용")
    void testUpdateCartItemQuantity() throws Exception {
        // Given
        when(cartService.updateItem(eq(BUYER_ID), any(UpdateCartItemCommand.class))).thenReturn(cartWith(5));

        // When
        mockMvc.perform(withProtocolHeaders(put("/carts/items/{product_id}", "p1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].quantity").value(5));

        // Then
        ArgumentCaptor<UpdateCartItemCommand> captor = ArgumentCaptor.forClass(UpdateCartItemCommand.class);
        verify(cartService).updateItem(eq(BUYER_ID), captor.capture());
        assertEquals("p1", captor.getValue().getProductId());
        assertEquals(5, captor.getValue().getQuantity());
    }

    @Test
    @DisplayName("항목 삭제 - 빈 장바구니 반환")
    void testRemoveCartItem() throws Exception {
        when(cartService.removeItem(BUYER_ID, "p1")).thenReturn(CartView.of(BUYER_ID, List.of()));

        mockMvc.perform(withProtocolHeaders(delete("/carts/items/{product_id}", "p1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty())
                .andExpect(jsonPath("$.total_price").value(0));
    }
}
