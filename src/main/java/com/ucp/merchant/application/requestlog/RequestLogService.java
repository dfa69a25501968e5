package com.ucp.merchant.application.requestlog;

import com.ucp.merchant.application.requestlog.dto.RequestLogCommand;
import com.ucp.merchant.domain.requestlog.RequestLog;
import com.ucp.merchant.domain.requestlog.RequestLogRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * RequestLogService - 프로토콜 요청 기록/조회
 */
@Service
public class RequestLogService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final RequestLogRepository requestLogRepository;
    private final Clock clock;

    public RequestLogService(RequestLogRepository requestLogRepository, Clock clock) {
        this.requestLogRepository = requestLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(RequestLogCommand command) {
        requestLogRepository.save(RequestLog.builder()
                .requestId(command.getRequestId())
                .agent(command.getAgent())
                .method(command.getMethod())
                .path(command.getPath())
                .checkoutSessionId(command.getCheckoutSessionId())
                .responseStatus(command.getResponseStatus())
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    @Transactional(readOnly = true)
    public List<RequestLog> findRecent(String checkoutSessionId, Integer limit) {
        int normalized = (limit == null || limit <= 0) ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        return requestLogRepository.findRecent(checkoutSessionId, normalized);
    }
}
