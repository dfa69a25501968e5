package com.ucp.merchant.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.application.catalogue.dto.CategorySummary;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 카테고리별 상품 수 응답 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CategoryListResponse {

    private List<CategoryItem> categories;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryItem {
        private String name;

        @JsonProperty("product_count")
        private Long productCount;
    }

    public static CategoryListResponse from(List<CategorySummary> summaries) {
        return new CategoryListResponse(summaries.stream()
                .map(summary -> new CategoryItem(summary.getName(), summary.getProductCount()))
                .collect(Collectors.toList()));
    }
}
