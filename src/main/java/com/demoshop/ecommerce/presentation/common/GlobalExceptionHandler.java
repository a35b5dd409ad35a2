package com.demoshop.ecommerce.presentation.common;

import com.demoshop.ecommerce.common.exception.BizException;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import com.demoshop.ecommerce.common.exception.ErrorType;
import com.demoshop.ecommerce.common.exception.SystemException;
import com.demoshop.ecommerce.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 역할:
 * - 모든 계층에서 발생하는 예외를 잡아서 통일된 에러 응답으로 변환
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_CART_NOT_FOUND",
 *   "error_type": "NOT_FOUND",
 *   "error_message": "메시지",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 코드 (VALIDATION/INSUFFICIENT_STOCK 400, NOT_FOUND 404, SYSTEM 5XX)
 * - 요청 본문/파라미터 형식 오류: 400 INVALID_REQUEST
 * - 매핑 없는 경로: 404, 지원하지 않는 메서드: 405
 * - 그 외: 500 Internal Server Error
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 비즈니스 예외 (DomainException, SystemException)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e instanceof SystemException) {
            logger.error("System exception occurred: ", e);
        } else {
            logger.debug("Business rule rejected request: {}", e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(
                e.getErrorCodeValue(), e.getErrorType().name(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 요청 본문 파싱 실패 (400)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        return invalidRequest("요청 본문이 올바르지 않습니다");
    }

    /**
     * 필수 쿼리 파라미터 누락 (400)
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameterException(MissingServletRequestParameterException e) {
        return invalidRequest(e.getParameterName() + " 파라미터는 필수입니다");
    }

    /**
     * 파라미터 타입 불일치 (400) - 예: limit=abc
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        return invalidRequest(e.getName() + " 파라미터 형식이 올바르지 않습니다");
    }

    /**
     * 매핑되지 않은 경로 (404)
     */
    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class})
    public ResponseEntity<ErrorResponse> handleNoHandlerFoundException(Exception e) {
        return errorOf(ErrorCode.RESOURCE_NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupportedException(HttpRequestMethodNotSupportedException e) {
        return errorOf(ErrorCode.METHOD_NOT_ALLOWED);
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        return errorOf(ErrorCode.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> errorOf(ErrorCode errorCode) {
        ErrorResponse errorResponse = ErrorResponse.of(
                errorCode.getCode(), errorCode.getType().name(), errorCode.getMessage());
        return ResponseEntity.status(errorCode.getStatusCode()).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> invalidRequest(String message) {
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INVALID_REQUEST.getCode(), ErrorType.VALIDATION.name(), message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }
}
