package com.ucp.merchant.presentation.common;

import com.ucp.merchant.common.exception.BizException;
import com.ucp.merchant.common.exception.ErrorCode;
import com.ucp.merchant.domain.payment.InvalidSignatureException;
import com.ucp.merchant.domain.product.InsufficientInventoryException;
import com.ucp.merchant.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CHECKOUT_SESSION_EXPIRED",
 *   "error_message": "체크아웃 세션이 만료되었습니다",
 *   "category": "EXPIRED",
 *   "retryable": false,
 *   "timestamp": "...",
 *   "request_id": "..."
 * }
 *
 * HTTP 상태 코드 매핑 (ErrorCode 기준):
 * - 400 ValidationError, 401 InvalidSignature, 404 NotFound
 * - 409 Conflict / InsufficientInventory, 410 Expired
 * - 503 Transient, 500 Internal
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 위조/손상된 결제 클레임 (401)
     */
    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignatureException(InvalidSignatureException e) {
        logger.warn("서명 검증 실패: {}", e.getMessage());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    /**
     * 재고 부족 (409). FULFILLMENT_BLOCKED는 retryable=true
     */
    @ExceptionHandler(InsufficientInventoryException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientInventoryException(InsufficientInventoryException e) {
        logger.info("재고 부족: code={}, productId={}, requested={}",
                e.getErrorCodeValue(), e.getProductId(), e.getRequestedQuantity());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    /**
     * 그 외 비즈니스 예외 (ErrorCode의 HTTP 상태 사용)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("시스템 예외: code={}", e.getErrorCodeValue(), e);
        } else {
            logger.info("요청 거절: code={}, message={}", e.getErrorCodeValue(), e.getMessage());
        }
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    /**
     * 요청 본문 Bean Validation 실패 (400)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValidException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return toResponse(ErrorCode.VALIDATION_ERROR, ErrorCode.VALIDATION_ERROR.getMessage() + " | " + message);
    }

    /**
     * 필수 헤더 누락 (400) - Request-Signature, X-BUYER-ID 등
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        return toResponse(ErrorCode.MISSING_REQUIRED_HEADER,
                ErrorCode.MISSING_REQUIRED_HEADER.getMessage() + " | " + e.getHeaderName());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        return toResponse(ErrorCode.VALIDATION_ERROR, ErrorCode.VALIDATION_ERROR.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFoundException(NoResourceFoundException e) {
        return toResponse(ErrorCode.RESOURCE_NOT_FOUND, ErrorCode.RESOURCE_NOT_FOUND.getMessage());
    }

    /**
     * 재시도 한도를 넘긴 저장소 경합 (503)
     */
    @ExceptionHandler({TransientDataAccessException.class, DuplicateKeyException.class})
    public ResponseEntity<ErrorResponse> handleTransientDataAccessException(Exception e) {
        logger.warn("저장소 경합으로 요청 실패: {}", e.getMessage());
        return toResponse(ErrorCode.TRANSIENT_STORE_CONTENTION, ErrorCode.TRANSIENT_STORE_CONTENTION.getMessage());
    }

    /**
     * 키 경합이 아닌 무결성 위반 (값 길이 초과 등, 400)
     * 같은 요청을 다시 보내도 성공하지 않으므로 재시도 불가로 응답한다.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(DataIntegrityViolationException e) {
        logger.warn("저장할 수 없는 요청 값: {}", e.getMostSpecificCause().getMessage());
        return toResponse(ErrorCode.VALIDATION_ERROR, ErrorCode.VALIDATION_ERROR.getMessage());
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        return toResponse(ErrorCode.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
    }

    private ResponseEntity<ErrorResponse> toResponse(ErrorCode errorCode, String message) {
        return ResponseEntity.status(errorCode.getStatusCode()).body(ErrorResponse.of(errorCode, message));
    }
}
