package com.ucp.merchant.infrastructure.config;

import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.order.event.OrderRecordedEvent;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * KafkaConfig - 주문 이벤트 Producer 설정
 *
 * ucp.events.kafka.enabled=true 일 때만 활성화된다.
 *
 * Producer 설정:
 * - acks=all: 모든 ISR 복제 완료 후 ack
 * - enable.idempotence=true: 프로듀서 재전송으로 인한 중복 방지
 * - compression.type=snappy, linger.ms=10: 배치 전송
 */
@Configuration
@ConditionalOnProperty(prefix = "ucp.events.kafka", name = "enabled", havingValue = "true")
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, OrderRecordedEvent> orderEventProducerFactory(UcpProperties properties) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getEvents().getKafka().getBootstrapServers());
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);

        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        configProps.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "snappy");
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 10);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, OrderRecordedEvent> orderEventKafkaTemplate(
            ProducerFactory<String, OrderRecordedEvent> orderEventProducerFactory) {
        return new KafkaTemplate<>(orderEventProducerFactory);
    }
}
