package com.asnswap.backend.auth.identity.otp.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OTP 발송 응답
 * - debugCode는 app.otp.expose-debug-code=true 일 때만 채워진다. (null이면 JSON에서 빠짐)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OtpRequestResponse(
        String status,
        String message,
        @JsonProperty("debug_code") String debugCode
) {
    public static OtpRequestResponse sent(String debugCode) {
        return new OtpRequestResponse("ok", "OTP sent to email", debugCode);
    }
}
