package com.asnswap.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - status/message는 정책에 따라 바뀔 수 있지만, code는 최대한 고정한다.
 */
public enum ErrorCode {

    // OTP
    // INVALID / EXPIRED는 의도적으로 구분해서 내려준다. (토큰 쪽은 UNAUTHENTICATED 하나로 뭉갬)
    OTP_INVALID(HttpStatus.BAD_REQUEST,
            "Invalid code."),
    OTP_EXPIRED(HttpStatus.BAD_REQUEST,
            "Code expired. Please request a new one."),

    // Auth / Security
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED,
            "Authentication required."),
    ACCESS_DENIED(HttpStatus.FORBIDDEN,
            "You do not have permission to access this resource."),

    // Profile
    PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND,
            "Profile not found."),

    // Payment
    PAYMENT_NOT_CONFIGURED(HttpStatus.INTERNAL_SERVER_ERROR,
            "Payment provider is not configured."),
    PAYMENT_REQUEST_FAILED(HttpStatus.BAD_REQUEST,
            "Payment provider rejected the request."),

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "Invalid request."),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE,
            "Service temporarily unavailable. Please try again."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "Internal server error.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
