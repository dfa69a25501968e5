package com.ucp.merchant.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * RetryConfig - Spring Retry 설정
 *
 * 재시도 인터셉터는 트랜잭션 인터셉터보다 바깥에서 동작하므로
 * 각 재시도는 새로운 트랜잭션으로 실행된다.
 * (RetryConfiguration order = LOWEST_PRECEDENCE - 1, 트랜잭션 어드바이저 = LOWEST_PRECEDENCE)
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
