package com.ucp.merchant.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * UcpProperties - 머천트/프로토콜 설정 (application.yml의 ucp.*)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ucp")
public class UcpProperties {

    /** UCP 프로토콜 버전 */
    private String version = "2026-01-11";

    private Merchant merchant = new Merchant();
    private Checkout checkout = new Checkout();
    private Payment payment = new Payment();
    private Events events = new Events();

    @Getter
    @Setter
    public static class Merchant {
        private String name = "Artisan India";
        private String vpa = "artisan@paytm";
        /** 디스커버리 문서에 노출되는 서비스 엔드포인트 */
        private String endpoint = "http://localhost:8080";
        /** 요청 서명 검증용 HMAC-SHA256 비밀 키 */
        private String signingSecret;
        private List<String> productCategories = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Checkout {
        private Duration sessionTtl = Duration.ofMinutes(15);
        private ExpirySweep expirySweep = new ExpirySweep();
    }

    @Getter
    @Setter
    public static class ExpirySweep {
        private boolean enabled = true;
        /** 정리 주기 (밀리초) */
        private long intervalMs = 60000L;
    }

    @Getter
    @Setter
    public static class Payment {
        private String handlerId = "upi";
        private String handlerName = "in.npci.upi";
        /** QR 이미지 한 변 픽셀 수 */
        private int qrSize = 240;
    }

    @Getter
    @Setter
    public static class Events {
        private Kafka kafka = new Kafka();
    }

    @Getter
    @Setter
    public static class Kafka {
        private boolean enabled = false;
        private String bootstrapServers = "localhost:9092";
        private String topic = "ucp.order-events";
    }
}
