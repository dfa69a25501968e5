package com.ucp.merchant.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 상품 목록 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {

    private List<ProductResponse> products;

    @JsonProperty("total_count")
    private Integer totalCount;

    public static ProductListResponse from(List<Product> products) {
        List<ProductResponse> content = products.stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return new ProductListResponse(content, content.size());
    }
}
