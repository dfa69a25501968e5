package com.ucp.merchant.domain.checkout;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * CheckoutSession 도메인 엔티티 (고정 견적)
 *
 * 책임:
 * - 생성 시점 장바구니의 라인 항목 스냅샷과 합계 보관
 * - UPI 결제 링크 보관 (QR 이미지는 응답 시 링크로부터 파생)
 * - 조회 시점 만료 판정
 *
 * 핵심 비즈니스 규칙:
 * - totalMinorUnits == 라인 항목 소계의 합 (생성 이후 불변)
 * - 라인 항목은 생성 이후 변경 불가
 * - 상태 변경은 엔티티 setter가 아닌 CheckoutSessionRepository의 조건부 UPDATE로만 수행
 */
@Entity
@Table(name = "checkout_sessions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_checkout_sessions_buyer_creation_key", columnNames = {"buyer_id", "creation_key"})
        },
        indexes = {
                @Index(name = "idx_checkout_sessions_status_expires", columnList = "status, expires_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckoutSession {

    public static final String ID_PREFIX = "cs_";
    public static final String CURRENCY_INR = "INR";

    @Id
    @Column(name = "checkout_session_id", length = 64)
    private String id;

    @Column(name = "buyer_id", nullable = false, length = 128)
    private String buyerId;

    @Column(name = "creation_key", length = 255)
    private String creationKey;

    @Getter(AccessLevel.NONE)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "checkout_line_items",
            joinColumns = @JoinColumn(name = "checkout_session_id"))
    @OrderColumn(name = "line_no")
    private List<CheckoutLineItem> lineItems = new ArrayList<>();

    @Column(name = "total_minor_units", nullable = false)
    private Long totalMinorUnits;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "payment_link", nullable = false, length = 1000)
    private String paymentLink;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CheckoutStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private LocalDateTime expiresAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 추측 불가능한 세션 ID 생성 (cs_ + 128bit 난수 hex)
     */
    public static String newId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * PENDING 상태의 세션 생성
     *
     * @param paymentLink 이 세션 ID로 생성된 UPI 딥링크
     */
    public static CheckoutSession open(String id, String buyerId, String creationKey,
                                       List<CheckoutLineItem> lineItems, String paymentLink,
                                       LocalDateTime now, LocalDateTime expiresAt) {
        if (lineItems == null || lineItems.isEmpty()) {
            throw new IllegalArgumentException("체크아웃 세션에는 최소 하나의 라인 항목이 필요합니다");
        }
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("만료 시각은 생성 시각 이후여야 합니다");
        }

        CheckoutSession session = new CheckoutSession();
        session.id = id;
        session.buyerId = buyerId;
        session.creationKey = creationKey;
        session.lineItems = new ArrayList<>(lineItems);
        session.totalMinorUnits = lineItems.stream().mapToLong(CheckoutLineItem::getSubtotal).sum();
        session.currency = CURRENCY_INR;
        session.paymentLink = paymentLink;
        session.status = CheckoutStatus.PENDING;
        session.createdAt = now;
        session.expiresAt = expiresAt;
        session.updatedAt = now;
        return session;
    }

    public List<CheckoutLineItem> getLineItems() {
        return Collections.unmodifiableList(lineItems);
    }

    /**
     * 만료 시각이 지났는지 여부 (expiresAt 시각 자체도 만료로 간주)
     */
    public boolean isPastExpiry(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 조회 시점 기준 실효 상태
     * 전이되지 않은 채 만료 시각이 지난 PENDING 세션은 EXPIRED로 취급한다.
     */
    public CheckoutStatus effectiveStatus(LocalDateTime now) {
        if (status == CheckoutStatus.PENDING && isPastExpiry(now)) {
            return CheckoutStatus.EXPIRED;
        }
        return status;
    }

    /**
     * 서명 대상 페이로드 (id|total|buyer)
     */
    public String signaturePayload() {
        return id + "|" + totalMinorUnits + "|" + buyerId;
    }
}
