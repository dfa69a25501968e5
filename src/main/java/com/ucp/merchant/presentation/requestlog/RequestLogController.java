package com.ucp.merchant.presentation.requestlog;

import com.ucp.merchant.application.requestlog.RequestLogService;
import com.ucp.merchant.presentation.requestlog.response.RequestLogResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * RequestLogController - 프로토콜 요청 기록 조회 (최신순)
 */
@RestController
@RequestMapping("/request-logs")
public class RequestLogController {

    private final RequestLogService requestLogService;

    public RequestLogController(RequestLogService requestLogService) {
        this.requestLogService = requestLogService;
    }

    /**
     * @param checkoutSessionId 지정 시 해당 세션의 요청만
     * @param limit 기본값 50, 최대 500
     */
    @GetMapping
    public ResponseEntity<List<RequestLogResponse>> getRequestLogs(
            @RequestParam(value = "checkout_session_id", required = false) String checkoutSessionId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(requestLogService.findRecent(checkoutSessionId, limit).stream()
                .map(RequestLogResponse::from)
                .collect(Collectors.toList()));
    }
}
