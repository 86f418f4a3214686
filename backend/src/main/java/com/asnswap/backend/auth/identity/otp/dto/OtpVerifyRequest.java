package com.asnswap.backend.auth.identity.otp.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OtpVerifyRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email String email,

        // 코드는 받은 문자열 그대로 비교한다. (trim 안 함)
        @NotBlank
        @Size(max = 16) String code
) {}
