package com.ucp.merchant.application.catalogue;

import com.ucp.merchant.application.catalogue.dto.CategorySummary;
import com.ucp.merchant.domain.product.Product;
import com.ucp.merchant.domain.product.ProductConstants;
import com.ucp.merchant.domain.product.ProductNotFoundException;
import com.ucp.merchant.domain.product.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * CatalogueService - 상품 카탈로그 조회 (읽기 전용)
 *
 * 카탈로그 적재(CSV 수집/검증)는 외부 협력자 책임이며,
 * 이 서비스는 적재된 상품을 조회만 한다.
 */
@Service
@Transactional(readOnly = true)
public class CatalogueService {

    private final ProductRepository productRepository;

    public CatalogueService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    public Product lookupProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    /**
     * 키워드/카테고리 검색
     *
     * @param limit null이면 기본값(50), 최대 100으로 제한
     */
    public List<Product> searchProducts(String query, String category, Integer limit) {
        return productRepository.search(query, category, normalizeLimit(limit));
    }

    public List<Product> listAll() {
        return productRepository.findAll();
    }

    /**
     * 카테고리별 상품 수 (카테고리 없는 상품은 "general")
     */
    public List<CategorySummary> listCategories() {
        Map<String, Long> counts = productRepository.findAll().stream()
                .collect(Collectors.groupingBy(Product::getCategoryOrDefault, TreeMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .map(entry -> new CategorySummary(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    private int normalizeLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return ProductConstants.DEFAULT_SEARCH_LIMIT;
        }
        return Math.min(limit, ProductConstants.MAX_SEARCH_LIMIT);
    }
}
