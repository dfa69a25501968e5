package com.ucp.merchant.infrastructure.persistence;

import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;

/**
 * 무결성 위반 예외 분류
 *
 * JPA 경로에서는 UNIQUE/PK 경합과 값 길이 초과(DataException)가 모두
 * DataIntegrityViolationException으로 번역된다. 재시도 대상은 키 경합뿐이므로
 * 원인이 Hibernate ConstraintViolationException인 경우만 DuplicateKeyException으로 바꾼다.
 */
public final class UniqueKeyViolations {

    private UniqueKeyViolations() {
        throw new AssertionError("UniqueKeyViolations는 인스턴스화할 수 없습니다");
    }

    public static DataIntegrityViolationException classify(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return e;
        }
        for (Throwable cause = e.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                return new DuplicateKeyException(e.getMessage(), e);
            }
        }
        return e;
    }
}
