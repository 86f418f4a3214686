package com.asnswap.backend.auth.identity.otp.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OTP 검증 성공 응답
 * - 클라이언트는 access_token을 Authorization: Bearer <access_token> 으로 보낸다.
 */
public record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        String email
) {
    public static TokenResponse bearer(String accessToken, String email) {
        return new TokenResponse(accessToken, "bearer", email);
    }
}
