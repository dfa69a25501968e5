package com.ucp.merchant.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ucp.merchant.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 응답 DTO (가격은 paise 단위 정수)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {

    @JsonProperty("product_id")
    private String productId;

    private String title;

    private String description;

    private Long price;

    @JsonProperty("inventory_quantity")
    private Integer inventoryQuantity;

    private String category;

    @JsonProperty("image_url")
    private String imageUrl;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
                .productId(product.getProductId())
                .title(product.getTitle())
                .description(product.getDescription())
                .price(product.getPrice())
                .inventoryQuantity(product.getInventoryQuantity())
                .category(product.getCategoryOrDefault())
                .imageUrl(product.getImageUrl())
                .build();
    }
}
