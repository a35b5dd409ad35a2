package com.demoshop.ecommerce.common.exception;

/**
 * SystemException - 시스템/인프라 계층 오류 예외
 *
 * 사용 예:
 * - 사용자별 락 획득 실패 (대기 시간 초과, 인터럽트)
 *
 * 항상 서버 오류(5XX)로 응답한다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
