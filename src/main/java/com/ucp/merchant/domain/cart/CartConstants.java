package com.ucp.merchant.domain.cart;

/**
 * CartConstants - 장바구니 도메인 상수
 */
public final class CartConstants {

    /** 한 번에 담을 수 있는 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 라인 항목 최대 수량 */
    public static final int MAX_CART_QUANTITY = 1000;

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
