package com.ucp.merchant.infrastructure.persistence.requestlog;

import com.ucp.merchant.domain.requestlog.RequestLog;
import com.ucp.merchant.domain.requestlog.RequestLogRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 RequestLog Repository 구현
 */
@Repository
@Primary
public class MySQLRequestLogRepository implements RequestLogRepository {

    private final RequestLogJpaRepository requestLogJpaRepository;

    public MySQLRequestLogRepository(RequestLogJpaRepository requestLogJpaRepository) {
        this.requestLogJpaRepository = requestLogJpaRepository;
    }

    @Override
    public RequestLog save(RequestLog requestLog) {
        return requestLogJpaRepository.save(requestLog);
    }

    @Override
    public List<RequestLog> findRecent(String checkoutSessionId, int limit) {
        PageRequest page = PageRequest.of(0, limit);
        if (checkoutSessionId == null || checkoutSessionId.isBlank()) {
            return requestLogJpaRepository.findAllByOrderByRequestLogIdDesc(page);
        }
        return requestLogJpaRepository.findByCheckoutSessionIdOrderByRequestLogIdDesc(checkoutSessionId, page);
    }
}
