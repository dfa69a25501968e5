package com.ucp.merchant.presentation.checkout.mapper;

import com.ucp.merchant.application.checkout.UpiPaymentLinkGenerator;
import com.ucp.merchant.application.checkout.dto.CheckoutSessionResult;
import com.ucp.merchant.application.payment.dto.PaymentResult;
import com.ucp.merchant.config.UcpProperties;
import com.ucp.merchant.domain.checkout.CheckoutLineItem;
import com.ucp.merchant.domain.checkout.CheckoutSession;
import com.ucp.merchant.domain.checkout.CheckoutStatus;
import com.ucp.merchant.presentation.checkout.response.CheckoutLineItemResponse;
import com.ucp.merchant.presentation.checkout.response.CheckoutSessionResponse;
import com.ucp.merchant.presentation.checkout.response.PaymentResponse;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * CheckoutMapper - Application 결과를 Presentation 응답 DTO로 변환
 * 상태는 소문자로 노출한다 (pending, paid, failed, expired).
 */
@Component
public class CheckoutMapper {

    private final UcpProperties properties;

    public CheckoutMapper(UcpProperties properties) {
        this.properties = properties;
    }

    public CheckoutSessionResponse toCheckoutSessionResponse(CheckoutSessionResult result) {
        CheckoutSession session = result.getSession();
        return CheckoutSessionResponse.builder()
                .id(session.getId())
                .buyerId(session.getBuyerId())
                .status(toWireStatus(result.getStatus()))
                .lineItems(session.getLineItems().stream()
                        .map(this::toLineItemResponse)
                        .collect(Collectors.toList()))
                .total(session.getTotalMinorUnits())
                .totalAmount(UpiPaymentLinkGenerator.formatRupees(session.getTotalMinorUnits()))
                .currency(session.getCurrency())
                .payment(CheckoutSessionResponse.Payment.builder()
                        .handlerId(properties.getPayment().getHandlerId())
                        .paymentLink(session.getPaymentLink())
                        .qrCode(result.getQrImageBase64())
                        .build())
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .build();
    }

    public PaymentResponse toPaymentResponse(PaymentResult result) {
        return PaymentResponse.builder()
                .checkoutSessionId(result.getCheckoutSessionId())
                .orderId(result.getOrderId())
                .status(toWireStatus(result.getSessionStatus()))
                .utr(result.getUtr())
                .replayed(result.isReplayed())
                .build();
    }

    public static String toWireStatus(CheckoutStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }

    private CheckoutLineItemResponse toLineItemResponse(CheckoutLineItem item) {
        return CheckoutLineItemResponse.builder()
                .productId(item.getProductId())
                .title(item.getTitle())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .subtotal(item.getSubtotal())
                .build();
    }
}
