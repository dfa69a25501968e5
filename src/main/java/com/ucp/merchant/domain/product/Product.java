package com.ucp.merchant.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티
 *
 * 책임:
 * - 카탈로그 상품 정보 (제목, 설명, 카테고리, 이미지)
 * - 가격(paise 단위 정수)과 재고 수량 보관
 *
 * 핵심 비즈니스 규칙:
 * - 상품 정보는 카탈로그 적재 이후 변경되지 않음
 * - 재고는 결제가 확정된 주문에 의해서만 차감됨 (ProductRepository.decrementInventory)
 * - 가격은 0보다 커야 하고 재고는 음수가 될 수 없음
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_category", columnList = "category")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Product {

    @Id
    @Column(name = "product_id", length = 64)
    private String productId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false)
    private Long price;

    @Column(name = "inventory_quantity", nullable = false)
    private Integer inventoryQuantity;

    @Column(name = "category")
    private String category;

    @Column(name = "image_url", length = 1000)
    private String imageUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드 (카탈로그 적재 시 사용)
     *
     * 비즈니스 규칙:
     * - 상품 ID와 제목은 필수
     * - 가격은 0보다 커야 함
     * - 재고는 0 이상
     */
    public static Product create(String productId, String title, String description, Long price,
                                 Integer inventoryQuantity, String category, String imageUrl,
                                 LocalDateTime now) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (price == null || price <= 0) {
            throw new IllegalArgumentException("가격은 0보다 커야 합니다");
        }
        if (inventoryQuantity == null || inventoryQuantity < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }

        return Product.builder()
                .productId(productId)
                .title(title)
                .description(description)
                .price(price)
                .inventoryQuantity(inventoryQuantity)
                .category(category)
                .imageUrl(imageUrl)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 요청 수량만큼 현재 재고가 있는지 확인 (예약 없이 조회 시점 기준)
     */
    public boolean hasInventoryFor(int quantity) {
        return inventoryQuantity != null && inventoryQuantity >= quantity;
    }

    /**
     * 카테고리가 없는 상품은 "general"로 분류
     */
    public String getCategoryOrDefault() {
        return (category == null || category.isBlank()) ? ProductConstants.DEFAULT_CATEGORY : category;
    }

    /**
     * 단가 x 수량 소계
     */
    public long subtotalFor(int quantity) {
        return price * quantity;
    }
}
