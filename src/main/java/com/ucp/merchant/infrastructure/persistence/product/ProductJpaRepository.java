package com.ucp.merchant.infrastructure.persistence.product;

import com.ucp.merchant.domain.product.Product;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Product JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<Product, String> {

    /**
     * 키워드(소문자 패턴)와 카테고리로 검색
     * 키워드가 없으면 pattern = "%"
     */
    @Query("SELECT p FROM Product p " +
           "WHERE (LOWER(p.title) LIKE :pattern OR LOWER(p.description) LIKE :pattern) " +
           "AND (:category IS NULL OR p.category = :category) " +
           "ORDER BY p.productId")
    List<Product> search(@Param("pattern") String pattern,
                         @Param("category") String category,
                         Pageable pageable);

    /**
     * 원자적 재고 차감 (조건부 UPDATE)
     * 재고가 부족하면 0을 반환한다.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Product p SET p.inventoryQuantity = p.inventoryQuantity - :quantity, p.updatedAt = :now " +
           "WHERE p.productId = :productId AND p.inventoryQuantity >= :quantity")
    int decrementInventory(@Param("productId") String productId,
                           @Param("quantity") int quantity,
                           @Param("now") LocalDateTime now);
}
