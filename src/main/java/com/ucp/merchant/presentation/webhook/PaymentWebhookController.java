package com.ucp.merchant.presentation.webhook;

import com.ucp.merchant.application.payment.PaymentReconciliationService;
import com.ucp.merchant.application.payment.dto.ConfirmPaymentCommand;
import com.ucp.merchant.application.payment.dto.FailPaymentCommand;
import com.ucp.merchant.application.payment.dto.PaymentResult;
import com.ucp.merchant.domain.payment.MissingUtrException;
import com.ucp.merchant.presentation.checkout.mapper.CheckoutMapper;
import com.ucp.merchant.presentation.checkout.response.PaymentResponse;
import com.ucp.merchant.presentation.common.RequestLoggingInterceptor;
import com.ucp.merchant.presentation.common.UcpHeaders;
import com.ucp.merchant.presentation.webhook.request.PaymentEventType;
import com.ucp.merchant.presentation.webhook.request.PaymentWebhookRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * PaymentWebhookController - 결제 파트너(PSP) 웹훅 수신
 *
 * PAYMENT_SUCCEEDED → confirmPayment, PAYMENT_FAILED → failPayment
 * 같은 Idempotency-Key의 중복 전달은 최초 결과로 응답한다.
 */
@RestController
public class PaymentWebhookController {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookController.class);

    private final PaymentReconciliationService paymentReconciliationService;
    private final CheckoutMapper checkoutMapper;

    public PaymentWebhookController(PaymentReconciliationService paymentReconciliationService,
                                    CheckoutMapper checkoutMapper) {
        this.paymentReconciliationService = paymentReconciliationService;
        this.checkoutMapper = checkoutMapper;
    }

    @PostMapping("/webhooks/partners/{partner_id}/events/payment")
    public ResponseEntity<PaymentResponse> receivePaymentEvent(
            @PathVariable("partner_id") String partnerId,
            @RequestHeader(UcpHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            @RequestHeader(UcpHeaders.REQUEST_SIGNATURE) String requestSignature,
            @Valid @RequestBody PaymentWebhookRequest request,
            HttpServletRequest servletRequest) {
        servletRequest.setAttribute(RequestLoggingInterceptor.CHECKOUT_SESSION_ID_ATTRIBUTE, request.getCheckoutSessionId());
        log.info("결제 웹훅 수신: partnerId={}, eventType={}, sessionId={}",
                partnerId, request.getEventType(), request.getCheckoutSessionId());

        PaymentResult result;
        if (request.getEventType() == PaymentEventType.PAYMENT_SUCCEEDED) {
            if (request.getUtr() == null || request.getUtr().isBlank()) {
                throw new MissingUtrException(request.getCheckoutSessionId());
            }
            result = paymentReconciliationService.confirmPayment(new ConfirmPaymentCommand(
                    request.getCheckoutSessionId(), request.getUtr(), idempotencyKey, requestSignature));
        } else {
            String reason = (request.getReason() == null || request.getReason().isBlank())
                    ? FailPaymentCommand.REASON_PAYMENT_DECLINED
                    : request.getReason();
            result = paymentReconciliationService.failPayment(new FailPaymentCommand(
                    request.getCheckoutSessionId(), request.getUtr(), idempotencyKey, requestSignature, reason));
        }
        return ResponseEntity.ok(checkoutMapper.toPaymentResponse(result));
    }
}
