package com.ucp.merchant.domain.requestlog;

import java.util.List;

/**
 * RequestLog Repository Interface (Domain Layer - Port)
 */
public interface RequestLogRepository {

    RequestLog save(RequestLog requestLog);

    /**
     * 최신순 조회
     *
     * @param checkoutSessionId null이면 전체
     */
    List<RequestLog> findRecent(String checkoutSessionId, int limit);
}
