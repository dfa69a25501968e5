package com.ucp.merchant.domain.product;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ucp.merchant.support.TestFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Product 도메인 테스트")
class ProductTest {

    @Test
    @DisplayName("상품 생성 - 필수값 검증")
    void testCreate_Validation() {
        assertThrows(IllegalArgumentException.class, () -> Product.create(" ", "제목", null, 100L, 1, null, null, NOW));
        assertThrows(IllegalArgumentException.class, () -> Product.create("p1", null, null, 100L, 1, null, null, NOW));
        assertThrows(IllegalArgumentException.class, () -> Product.create("p1", "제목", null, 0L, 1, null, null, NOW));
        assertThrows(IllegalArgumentException.class, () -> Product.create("p1", "제목", null, 100L, -1, null, null, NOW));
    }

    @Test
    @DisplayName("재고 확인 - 경계값")
    void testHasInventoryFor() {
        Product product = Product.create("p1", "제목", null, 100L, 5, null, null, NOW);

        assertTrue(product.hasInventoryFor(5));
        assertFalse(product.hasInventoryFor(6));
    }

    @Test
    @DisplayName("카테고리가 없으면 general")
    void testCategoryOrDefault() {
        Product uncategorized = Product.create("p1", "제목", null, 100L, 5, null, null, NOW);
        Product blank = Product.create("p2", "제목", null, 100L, 5, "  ", null, NOW);
        Product textiles = Product.create("p3", "제목", null, 100L, 5, "Textiles", null, NOW);

        assertEquals("general", uncategorized.getCategoryOrDefault());
        assertEquals("general", blank.getCategoryOrDefault());
        assertEquals("Textiles", textiles.getCategoryOrDefault());
    }

    @Test
    @DisplayName("소계 = 단가 x 수량")
    void testSubtotalFor() {
        Product product = Product.create("p1", "제목", null, 50000L, 5, null, null, NOW);

        assertEquals(150000L, product.subtotalFor(3));
    }

    @Test
    @DisplayName("생성 시각은 호출자가 넘긴 시각")
    void testCreate_UsesCallerTime() {
        Product product = Product.create("p1", "제목", null, 100L, 5, null, null, NOW);

        assertEquals(NOW, product.getCreatedAt());
        assertEquals(NOW, product.getUpdatedAt());
    }
}
