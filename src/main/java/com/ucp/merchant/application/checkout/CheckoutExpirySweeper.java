package com.ucp.merchant.application.checkout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료 세션 정리 작업
 *
 * 만료 판정 자체는 조회 시점에 이루어지므로 정확성에는 필요 없다.
 * 상태 컬럼을 실제 상태와 맞춰 두기 위한 정리 작업이며,
 * 결제 확인과의 경합은 조건부 UPDATE가 해결한다.
 */
@Component
@ConditionalOnProperty(prefix = "ucp.checkout.expiry-sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CheckoutExpirySweeper {

    private static final Logger log = LoggerFactory.getLogger(CheckoutExpirySweeper.class);

    private final CheckoutService checkoutService;

    public CheckoutExpirySweeper(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    @Scheduled(fixedDelayString = "${ucp.checkout.expiry-sweep.interval-ms:60000}")
    public void sweep() {
        try {
            int expired = checkoutService.expireStaleSessions();
            if (expired > 0) {
                log.info("만료 세션 정리: {}건 EXPIRED 전환", expired);
            }
        } catch (Exception e) {
            log.warn("만료 세션 정리 실패, 다음 주기에 재시도: {}", e.getMessage(), e);
        }
    }
}
