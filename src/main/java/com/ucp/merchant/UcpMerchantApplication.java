package com.ucp.merchant;

import com.ucp.merchant.config.UcpProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * UCP 머천트 커머스 세션 엔진 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 주문 이벤트 리스너 비동기 실행
 * - @EnableScheduling: 만료 세션 정리 작업
 * - @EnableAspectJAutoProxy: 재시도/트랜잭션 AOP 프록시
 */
@EnableAsync
@EnableScheduling
@EnableAspectJAutoProxy
@EnableConfigurationProperties(UcpProperties.class)
@SpringBootApplication
public class UcpMerchantApplication {

    public static void main(String[] args) {
        SpringApplication.run(UcpMerchantApplication.class, args);
    }

}
