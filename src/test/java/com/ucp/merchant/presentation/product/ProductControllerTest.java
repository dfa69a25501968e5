package com.ucp.merchant.presentation.product;

import com.ucp.merchant.application.catalogue.CatalogueService;
import com.ucp.merchant.application.catalogue.dto.CategorySummary;
import com.ucp.merchant.domain.product.Product;
import com.ucp.merchant.domain.product.ProductNotFoundException;
import com.ucp.merchant.presentation.common.GlobalExceptionHandler;
import com.ucp.merchant.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * ProductControllerTest - 상품/카탈로그 조회 API
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ProductController / CatalogueController 단위 테스트")
class ProductControllerTest {

    private MockMvc mockMvc;

    @Mock
    private CatalogueService catalogueService;

    @BeforeEach
    void setup() {
        this.mockMvc = MockMvcBuilders.standaloneSetup(
                        new ProductController(catalogueService),
                        new CatalogueController(catalogueService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("상품 검색 - 조건 전달 및 목록 반환")
    void testSearchProducts() throws Exception {
        // Given
        Product product = TestFixtures.product("p1", 50000L, 10);
        when(catalogueService.searchProducts("diya", "Handicrafts", 5)).thenReturn(List.of(product));

        // When & Then
        mockMvc.perform(get("/products")
                        .param("q", "diya")
                        .param("category", "Handicrafts")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(1))
                .andExpect(jsonPath("$.products[0].product_id").value("p1"))
                .andExpect(jsonPath("$.products[0].price").value(50000))
                .andExpect(jsonPath("$.products[0].inventory_quantity").value(10))
                .andExpect(jsonPath("$.products[0].category").value("Handicrafts"));
    }

    @Test
    @DisplayName("상품 검색 - limit 0 → 400")
    void testSearchProducts_InvalidLimit() throws Exception {
        mockMvc.perform(get("/products").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("PROTOCOL_VALIDATION_ERROR"));

        verifyNoInteractions(catalogueService);
    }

    @Test
    @DisplayName("상품 검색 - 숫자가 아닌 limit → 400")
    void testSearchProducts_NonNumericLimit() throws Exception {
        mockMvc.perform(get("/products").param("limit", "many"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("상품 단건 조회 - 없는 상품 → 404")
    void testGetProduct_NotFound() throws Exception {
        when(catalogueService.lookupProduct("nope")).thenThrow(new ProductNotFoundException("nope"));

        mockMvc.perform(get("/products/{product_id}", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("DOMAIN_PRODUCT_NOT_FOUND"))
                .andExpect(jsonPath("$.category").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("카테고리 요약 조회")
    void testGetCategories() throws Exception {
        when(catalogueService.listCategories()).thenReturn(List.of(
                new CategorySummary("Handicrafts", 3L),
                new CategorySummary("Textiles", 1L)));

        mockMvc.perform(get("/catalogue/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.categories[0].name").value("Handicrafts"))
                .andExpect(jsonPath("$.categories[0].product_count").value(3))
                .andExpect(jsonPath("$.categories[1].name").value("Textiles"));
    }

    @Test
    @DisplayName("카탈로그 전체 조회")
    void testGetCatalogue() throws Exception {
        when(catalogueService.listAll()).thenReturn(List.of(
                TestFixtures.product("p1", 100L, 1),
                TestFixtures.product("p2", 200L, 2)));

        mockMvc.perform(get("/catalogue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(2));
    }
}
