package com.asnswap.backend.chat.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 메시지 전송 요청
 * - 발신자(from)는 받지 않는다. 토큰의 email로 고정
 */
public record SendMessageRequest(
        @JsonProperty("to_email")
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email String toEmail,

        @NotBlank
        @Size(max = 2000) String content
) {}
