package com.demoshop.ecommerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    /**
     * 에러 응답 생성 헬퍼 메서드
     */
    public static ErrorResponse of(String errorCode, String errorType, String errorMessage) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId("req-" + UUID.randomUUID().toString().substring(0, 12))
                .build();
    }
}
