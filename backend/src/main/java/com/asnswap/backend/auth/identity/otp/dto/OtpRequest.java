package com.asnswap.backend.auth.identity.otp.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * 로그인 OTP 발송 요청
 * - 이메일 "형식"까지만 검증. 가입 여부는 묻지 않는다. (OTP 로그인 = 가입)
 */
public record OtpRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email String email
) {}
