package com.asnswap.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 *
 * 원칙:
 * - ControllerAdvice / EntryPoint / Filter 어디서 나가든 항상 같은 JSON 스키마를 유지한다.
 *
 * 필드:
 * - code: 클라이언트 분기용 안정 식별자 (ErrorCode.name())
 * - message: 사용자 메시지
 * - details: 추가 정보(필요 시만, null이면 JSON에서 빠짐)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,    // ex: "OTP_INVALID"
        String message, // ex: "Invalid code."
        Object details
) {
    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null);
    }

    public static ApiError of(ErrorCode errorCode, String messageOverride) {
        return new ApiError(errorCode.name(), messageOverride, null);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getDetails());
    }
}
