package com.ucp.merchant.presentation.common;

import com.ucp.merchant.application.requestlog.RequestLogService;
import com.ucp.merchant.application.requestlog.dto.RequestLogCommand;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * 프로토콜 요청 기록 인터셉터
 *
 * 헤더 검증 인터셉터보다 먼저 등록되므로 헤더 누락으로 거절된 요청도 기록된다.
 * 기록 실패는 응답에 영향을 주지 않는다.
 */
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    public static final String CHECKOUT_SESSION_ID_ATTRIBUTE = "ucp.checkoutSessionId";
    private static final String CHECKOUT_SESSION_PATH_VARIABLE = "checkout_session_id";

    private final RequestLogService requestLogService;

    public RequestLoggingInterceptor(RequestLogService requestLogService) {
        this.requestLogService = requestLogService;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        try {
            requestLogService.record(new RequestLogCommand(
                    MDC.get(UcpHeaders.MDC_REQUEST_ID),
                    request.getHeader(UcpHeaders.AGENT),
                    request.getMethod(),
                    request.getRequestURI(),
                    resolveCheckoutSessionId(request),
                    response.getStatus()));
        } catch (RuntimeException e) {
            log.warn("요청 기록 저장 실패: path={}, error={}", request.getRequestURI(), e.getMessage());
        }
    }

    /**
     * 세션 ID: 경로 변수 우선, 없으면 컨트롤러가 남긴 요청 속성 (세션 생성 응답)
     */
    @SuppressWarnings("unchecked")
    private String resolveCheckoutSessionId(HttpServletRequest request) {
        Object uriVariables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (uriVariables instanceof Map) {
            String fromPath = ((Map<String, String>) uriVariables).get(CHECKOUT_SESSION_PATH_VARIABLE);
            if (fromPath != null) {
                return fromPath;
            }
        }
        Object attribute = request.getAttribute(CHECKOUT_SESSION_ID_ATTRIBUTE);
        return attribute != null ? attribute.toString() : null;
    }
}
