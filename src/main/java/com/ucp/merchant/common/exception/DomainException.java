package com.ucp.merchant.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 사용 예:
 * - ProductNotFoundException: 상품 조회 실패
 * - InsufficientInventoryException: 재고 부족
 * - CheckoutSessionExpiredException: 만료된 세션에 대한 결제 확인
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
