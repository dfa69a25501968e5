package com.ucp.merchant.common.exception;

/**
 * ErrorCategory - 프로토콜 호출자에게 노출되는 에러 분류
 *
 * 역할:
 * - 구체적인 ErrorCode를 에이전트가 해석 가능한 상위 분류로 묶음
 * - 에이전트는 분류만 보고 재시도/사용자 안내 여부를 결정할 수 있음
 */
public enum ErrorCategory {
    NOT_FOUND,
    CONFLICT,
    INSUFFICIENT_INVENTORY,
    INVALID_SIGNATURE,
    EXPIRED,
    VALIDATION_ERROR,
    TRANSIENT,
    INTERNAL
}
