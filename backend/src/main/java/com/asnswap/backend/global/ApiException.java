package com.asnswap.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/도메인 정책 위반을 표현하는 예외 (중앙화된 ErrorCode 기반)
 *
 * - 서비스 계층: throw new ApiException(ErrorCode.OTP_EXPIRED);
 * - GlobalExceptionHandler / SecurityErrorWriter가 ApiError로 직렬화해 응답 포맷을 고정한다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final transient ErrorCode errorCode;
    private final HttpStatus status; // ex: HttpStatus.BAD_REQUEST
    private final String code;       // ex: "OTP_EXPIRED"
    private final transient Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null, null);
    }

    public ApiException(ErrorCode errorCode, Throwable cause) {
        this(errorCode, null, null, cause);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Object details, Throwable cause) {
        // super(...)는 첫 줄이어야 해서 errorCode null 검사보다 앞에 둘 수밖에 없음.
        super(resolveMessage(errorCode, messageOverride), cause);

        if (errorCode == null)
            throw new IllegalArgumentException("ErrorCode must not be null");

        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.details = details;
    }

    private static String resolveMessage(ErrorCode errorCode, String messageOverride) {
        if (messageOverride != null && !messageOverride.isBlank()) {
            return messageOverride;
        }
        return (errorCode == null) ? null : errorCode.defaultMessage();
    }
}
