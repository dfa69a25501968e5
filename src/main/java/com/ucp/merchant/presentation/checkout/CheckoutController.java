package com.ucp.merchant.presentation.checkout;

import com.ucp.merchant.application.checkout.CheckoutService;
import com.ucp.merchant.application.checkout.dto.CheckoutSessionResult;
import com.ucp.merchant.application.payment.PaymentReconciliationService;
import com.ucp.merchant.application.payment.dto.ConfirmPaymentCommand;
import com.ucp.merchant.application.payment.dto.FailPaymentCommand;
import com.ucp.merchant.presentation.checkout.mapper.CheckoutMapper;
import com.ucp.merchant.presentation.checkout.request.CompletePaymentRequest;
import com.ucp.merchant.presentation.checkout.response.CheckoutSessionResponse;
import com.ucp.merchant.presentation.checkout.response.PaymentResponse;
import com.ucp.merchant.presentation.common.RequestLoggingInterceptor;
import com.ucp.merchant.presentation.common.UcpHeaders;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * CheckoutController - 체크아웃 세션 API (Presentation 계층)
 *
 * POST /checkout-sessions - 장바구니로 세션 생성 (Idempotency-Key 단위 멱등)
 * GET  /checkout-sessions/{checkout_session_id} - 세션 조회 (만료 판정 반영)
 * POST /checkout-sessions/{checkout_session_id}/complete - UTR 클레임으로 결제 확인
 * POST /checkout-sessions/{checkout_session_id}/cancel - 구매자 취소
 */
@RestController
@RequestMapping("/checkout-sessions")
public class CheckoutController {

    private final CheckoutService checkoutService;
    private final PaymentReconciliationService paymentReconciliationService;
    private final CheckoutMapper checkoutMapper;

    public CheckoutController(CheckoutService checkoutService,
                              PaymentReconciliationService paymentReconciliationService,
                              CheckoutMapper checkoutMapper) {
        this.checkoutService = checkoutService;
        this.paymentReconciliationService = paymentReconciliationService;
        this.checkoutMapper = checkoutMapper;
    }

    @PostMapping
    public ResponseEntity<CheckoutSessionResponse> createCheckoutSession(
            @RequestHeader(UcpHeaders.BUYER_ID) String buyerId,
            @RequestHeader(UcpHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            HttpServletRequest servletRequest) {
        CheckoutSessionResult result = checkoutService.createCheckoutSession(buyerId, idempotencyKey);
        servletRequest.setAttribute(RequestLoggingInterceptor.CHECKOUT_SESSION_ID_ATTRIBUTE, result.getSession().getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(checkoutMapper.toCheckoutSessionResponse(result));
    }

    @GetMapping("/{checkout_session_id}")
    public ResponseEntity<CheckoutSessionResponse> getCheckoutSession(
            @PathVariable("checkout_session_id") String checkoutSessionId) {
        return ResponseEntity.ok(checkoutMapper.toCheckoutSessionResponse(
                checkoutService.getCheckoutSession(checkoutSessionId)));
    }

    /**
     * 결제 확인. 같은 Idempotency-Key 재요청은 최초 결과를 replayed=true로 돌려준다.
     */
    @PostMapping("/{checkout_session_id}/complete")
    public ResponseEntity<PaymentResponse> completeCheckoutSession(
            @PathVariable("checkout_session_id") String checkoutSessionId,
            @RequestHeader(UcpHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            @RequestHeader(UcpHeaders.REQUEST_SIGNATURE) String requestSignature,
            @Valid @RequestBody CompletePaymentRequest request) {
        ConfirmPaymentCommand command = new ConfirmPaymentCommand(
                checkoutSessionId, request.getUtr(), idempotencyKey, requestSignature);
        return ResponseEntity.ok(checkoutMapper.toPaymentResponse(paymentReconciliationService.confirmPayment(command)));
    }

    @PostMapping("/{checkout_session_id}/cancel")
    public ResponseEntity<PaymentResponse> cancelCheckoutSession(
            @PathVariable("checkout_session_id") String checkoutSessionId,
            @RequestHeader(UcpHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
            @RequestHeader(UcpHeaders.REQUEST_SIGNATURE) String requestSignature) {
        FailPaymentCommand command = new FailPaymentCommand(
                checkoutSessionId, null, idempotencyKey, requestSignature, FailPaymentCommand.REASON_CANCELED_BY_BUYER);
        return ResponseEntity.ok(checkoutMapper.toPaymentResponse(paymentReconciliationService.failPayment(command)));
    }
}
