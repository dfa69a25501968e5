package com.ucp.merchant.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 수량 변경 명령. quantity <= 0 이면 항목 삭제로 처리된다.
 */
@Getter
@AllArgsConstructor
public class UpdateCartItemCommand {
    private String productId;
    private Integer quantity;
}
