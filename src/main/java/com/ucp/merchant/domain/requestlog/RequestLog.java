package com.ucp.merchant.domain.requestlog;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * RequestLog 엔티티
 * 프로토콜 요청 추적용 기록 (Request-Id, 에이전트, 경로, 세션 ID, 응답 상태)
 */
@Entity
@Table(name = "request_logs", indexes = {
        @Index(name = "idx_request_logs_checkout_session", columnList = "checkout_session_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RequestLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "request_log_id")
    private Long requestLogId;

    @Column(name = "request_id", length = 128)
    private String requestId;

    @Column(name = "agent", length = 255)
    private String agent;

    @Column(name = "method", nullable = false, length = 10)
    private String method;

    @Column(name = "path", nullable = false, length = 1000)
    private String path;

    @Column(name = "checkout_session_id", length = 64)
    private String checkoutSessionId;

    @Column(name = "response_status", nullable = false)
    private Integer responseStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
