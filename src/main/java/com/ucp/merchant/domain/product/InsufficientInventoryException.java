package com.ucp.merchant.domain.product;

import com.ucp.merchant.common.exception.DomainException;
import com.ucp.merchant.common.exception.ErrorCode;
import lombok.Getter;

/**
 * InsufficientInventoryException - 재고 부족
 *
 * 두 가지 상황에서 발생:
 * - 장바구니 담기/체크아웃 생성: 조회 시점 재고 부족 (INSUFFICIENT_INVENTORY, 재시도 불가)
 * - 결제 확인 중 원자적 차감 실패: 결제는 되었으나 이행이 막힘 (FULFILLMENT_BLOCKED, 재시도 가능)
 */
@Getter
public class InsufficientInventoryException extends DomainException {

    private final String productId;
    private final int requestedQuantity;

    public InsufficientInventoryException(String productId, int requestedQuantity) {
        this(ErrorCode.INSUFFICIENT_INVENTORY, productId, requestedQuantity);
    }

    private InsufficientInventoryException(ErrorCode errorCode, String productId, int requestedQuantity) {
        super(errorCode, "productId=" + productId + ", requested=" + requestedQuantity);
        this.productId = productId;
        this.requestedQuantity = requestedQuantity;
    }

    /**
     * 결제 확인 단계의 재고 경합 (세션은 PENDING 유지, 재시도 가능)
     */
    public static InsufficientInventoryException fulfillmentBlocked(String productId, int requestedQuantity) {
        return new InsufficientInventoryException(ErrorCode.FULFILLMENT_BLOCKED, productId, requestedQuantity);
    }
}
