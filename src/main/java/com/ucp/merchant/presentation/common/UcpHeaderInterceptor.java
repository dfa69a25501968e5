package com.ucp.merchant.presentation.common;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Set;

/**
 * UCP 필수 헤더 검증 인터셉터
 *
 * - 변경 요청(POST/PUT/PATCH/DELETE): UCP-Agent, Idempotency-Key, Request-Id 필수
 * - Idempotency-Key는 저장 컬럼 길이(255자)를 넘을 수 없다
 * - Request-Signature는 결제 확인/취소/웹훅 컨트롤러의 @RequestHeader로 검증
 * - Request-Id의 MDC 등록은 RequestIdFilter가 담당
 */
@Component
public class UcpHeaderInterceptor implements HandlerInterceptor {

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (MUTATING_METHODS.contains(request.getMethod())) {
            requireHeader(request, UcpHeaders.AGENT);
            requireHeader(request, UcpHeaders.IDEMPOTENCY_KEY);
            requireHeader(request, UcpHeaders.REQUEST_ID);
            requireMaxLength(request, UcpHeaders.IDEMPOTENCY_KEY, UcpHeaders.MAX_IDEMPOTENCY_KEY_LENGTH);
        }
        return true;
    }

    private void requireHeader(HttpServletRequest request, String name) {
        if (!hasText(request.getHeader(name))) {
            throw new MissingProtocolHeaderException(name);
        }
    }

    private void requireMaxLength(HttpServletRequest request, String name, int maxLength) {
        String value = request.getHeader(name);
        if (value.length() > maxLength) {
            throw new InvalidProtocolHeaderException(name, maxLength);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
