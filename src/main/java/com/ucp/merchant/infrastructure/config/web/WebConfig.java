package com.ucp.merchant.infrastructure.config.web;

import com.ucp.merchant.presentation.common.RequestLoggingInterceptor;
import com.ucp.merchant.presentation.common.UcpHeaderInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * WebConfig - 프로토콜 인터셉터 등록
 *
 * UCP 디스커버리 문서는 /.well-known/ucp 에 있어야 하므로 경로 prefix는 두지 않는다.
 * 등록 순서: 요청 기록 → 헤더 검증
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final RequestLoggingInterceptor requestLoggingInterceptor;
    private final UcpHeaderInterceptor ucpHeaderInterceptor;

    public WebConfig(RequestLoggingInterceptor requestLoggingInterceptor,
                     UcpHeaderInterceptor ucpHeaderInterceptor) {
        this.requestLoggingInterceptor = requestLoggingInterceptor;
        this.ucpHeaderInterceptor = ucpHeaderInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(requestLoggingInterceptor)
                .excludePathPatterns("/request-logs/**");
        registry.addInterceptor(ucpHeaderInterceptor);
    }
}
