package com.ucp.merchant.domain.product;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 카탈로그 조회와 원자적 재고 차감을 제공한다.
 */
public interface ProductRepository {

    Optional<Product> findById(String productId);

    List<Product> findAll();

    /**
     * 키워드(제목/설명 부분 일치)와 카테고리로 상품 검색
     *
     * @param query    null이면 키워드 조건 없음
     * @param category null이면 카테고리 조건 없음
     * @param limit    최대 반환 개수
     */
    List<Product> search(String query, String category, int limit);

    /**
     * 원자적 재고 차감 (check-and-decrement)
     *
     * 단일 조건부 UPDATE로 수행한다:
     * UPDATE products SET inventory_quantity = inventory_quantity - :qty
     *  WHERE product_id = :id AND inventory_quantity >= :qty
     *
     * 조회 후 쓰기 방식은 동시 결제 확인 간 초과 판매를 유발하므로 사용하지 않는다.
     *
     * @return 차감 성공 시 true, 재고 부족(또는 상품 없음) 시 false
     */
    boolean decrementInventory(String productId, int quantity, LocalDateTime now);

    Product save(Product product);
}
