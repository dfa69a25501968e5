package com.ucp.merchant.application.payment;

import com.ucp.merchant.application.payment.dto.ConfirmPaymentCommand;
import com.ucp.merchant.application.payment.dto.FailPaymentCommand;
import com.ucp.merchant.application.payment.dto.PaymentResult;
import com.ucp.merchant.common.exception.TransientStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

/**
 * PaymentReconciliationService - Payment Reconciliation 진입점
 *
 * 역할:
 * - PaymentTransactionService(트랜잭션 + 재시도) 호출
 * - 재시도 한도를 소진한 저장소 경합을 TransientStoreException(503, 재시도 가능)으로 변환
 *
 * 호출자가 구분할 수 있는 결과:
 * - "아무 일도 일어나지 않음, 재시도": TRANSIENT, FULFILLMENT_BLOCKED
 * - "결제가 거절됨": sessionStatus=FAILED
 * - "이미 처리됨": replayed=true 또는 CHECKOUT_SESSION_ALREADY_FINALIZED
 */
@Service
public class PaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PaymentReconciliationService.class);

    private final PaymentTransactionService paymentTransactionService;

    public PaymentReconciliationService(PaymentTransactionService paymentTransactionService) {
        this.paymentTransactionService = paymentTransactionService;
    }

    public PaymentResult confirmPayment(ConfirmPaymentCommand command) {
        try {
            return paymentTransactionService.confirm(command);
        } catch (TransientDataAccessException | DuplicateKeyException e) {
            log.warn("결제 확인 재시도 한도 초과: sessionId={}, key={}, error={}",
                    command.getCheckoutSessionId(), command.getIdempotencyKey(), e.getMessage());
            throw new TransientStoreException("checkoutSessionId=" + command.getCheckoutSessionId(), e);
        }
    }

    public PaymentResult failPayment(FailPaymentCommand command) {
        try {
            return paymentTransactionService.fail(command);
        } catch (TransientDataAccessException | DuplicateKeyException e) {
            log.warn("결제 실패 처리 재시도 한도 초과: sessionId={}, key={}, error={}",
                    command.getCheckoutSessionId(), command.getIdempotencyKey(), e.getMessage());
            throw new TransientStoreException("checkoutSessionId=" + command.getCheckoutSessionId(), e);
        }
    }
}
