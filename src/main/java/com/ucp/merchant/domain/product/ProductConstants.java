package com.ucp.merchant.domain.product;

/**
 * 카탈로그 조회 관련 상수
 */
public final class ProductConstants {

    public static final String DEFAULT_CATEGORY = "general";

    public static final int DEFAULT_SEARCH_LIMIT = 50;
    public static final int MAX_SEARCH_LIMIT = 100;

    private ProductConstants() {
        throw new AssertionError("Cannot instantiate ProductConstants");
    }
}
