package com.ucp.merchant.presentation.product;

import com.ucp.merchant.application.catalogue.CatalogueService;
import com.ucp.merchant.presentation.product.response.CategoryListResponse;
import com.ucp.merchant.presentation.product.response.ProductListResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CatalogueController - 카탈로그 전체 조회 / 카테고리 요약
 */
@RestController
@RequestMapping("/catalogue")
public class CatalogueController {

    private final CatalogueService catalogueService;

    public CatalogueController(CatalogueService catalogueService) {
        this.catalogueService = catalogueService;
    }

    @GetMapping
    public ResponseEntity<ProductListResponse> getCatalogue() {
        return ResponseEntity.ok(ProductListResponse.from(catalogueService.listAll()));
    }

    /**
     * GET /catalogue/categories - 카테고리별 상품 수 (이름순)
     */
    @GetMapping("/categories")
    public ResponseEntity<CategoryListResponse> getCategories() {
        return ResponseEntity.ok(CategoryListResponse.from(catalogueService.listCategories()));
    }
}
