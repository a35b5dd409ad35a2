package com.demoshop.ecommerce.common.exception;

/**
 * 필수 입력 누락 등 요청 자체가 잘못된 경우 발생하는 예외 (ErrorType.VALIDATION)
 *
 * 호출 예시:
 * - throw new InvalidRequestException(ErrorCode.USER_ID_REQUIRED)
 * - throw new InvalidRequestException(ErrorCode.SEARCH_QUERY_REQUIRED)
 */
public class InvalidRequestException extends DomainException {

    public InvalidRequestException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InvalidRequestException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    /**
     * 사용자 ID 필수 검증
     *
     * @param userId 검증할 사용자 ID
     * @return 검증된 사용자 ID
     */
    public static String requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException(ErrorCode.USER_ID_REQUIRED);
        }
        return userId;
    }
}
