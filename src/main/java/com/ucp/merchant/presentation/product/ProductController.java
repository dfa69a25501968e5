package com.ucp.merchant.presentation.product;

import com.ucp.merchant.application.catalogue.CatalogueService;
import com.ucp.merchant.presentation.product.response.ProductListResponse;
import com.ucp.merchant.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * ProductController - 상품 조회 API (Presentation 계층)
 * GET /products - 키워드/카테고리 검색
 * GET /products/{product_id} - 상품 단건 조회
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final CatalogueService catalogueService;

    public ProductController(CatalogueService catalogueService) {
        this.catalogueService = catalogueService;
    }

    /**
     * 상품 검색
     *
     * @param q 제목/설명 키워드 (생략 시 전체)
     * @param category 카테고리 (정확히 일치)
     * @param limit 최대 개수 (기본값 50, 최대 100)
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> searchProducts(
            @RequestParam(value = "q", required = false) String q,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "limit", required = false) Integer limit) {

        if (limit != null && limit < 1) {
            throw new IllegalArgumentException("limit은 1 이상이어야 합니다");
        }

        return ResponseEntity.ok(ProductListResponse.from(catalogueService.searchProducts(q, category, limit)));
    }

    @GetMapping("/{product_id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("product_id") String productId) {
        return ResponseEntity.ok(ProductResponse.from(catalogueService.lookupProduct(productId)));
    }
}
