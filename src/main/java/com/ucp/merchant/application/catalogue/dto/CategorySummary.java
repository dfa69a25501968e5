package com.ucp.merchant.application.catalogue.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 카테고리별 상품 수
 */
@Getter
@AllArgsConstructor
public class CategorySummary {
    private String name;
    private long productCount;
}
