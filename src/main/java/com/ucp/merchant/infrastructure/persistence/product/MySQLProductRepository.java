package com.ucp.merchant.infrastructure.persistence.product;

import com.ucp.merchant.domain.product.Product;
import com.ucp.merchant.domain.product.ProductRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Port(ProductRepository) 인터페이스를 Spring Data JPA로 구현
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(String productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public List<Product> findAll() {
        return productJpaRepository.findAll();
    }

    @Override
    public List<Product> search(String query, String category, int limit) {
        String pattern = (query == null || query.isBlank())
                ? "%"
                : "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        String categoryFilter = (category == null || category.isBlank()) ? null : category;
        return productJpaRepository.search(pattern, categoryFilter, PageRequest.of(0, limit));
    }

    /**
     * 단일 UPDATE ... WHERE inventory_quantity >= :qty 로 확인과 차감을 한 번에 수행
     * 행 잠금은 UPDATE 문이 획득하며 트랜잭션 종료 시 해제된다.
     */
    @Override
    public boolean decrementInventory(String productId, int quantity, LocalDateTime now) {
        return productJpaRepository.decrementInventory(productId, quantity, now) == 1;
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }
}
