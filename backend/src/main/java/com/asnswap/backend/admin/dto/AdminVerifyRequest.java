package com.asnswap.backend.admin.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AdminVerifyRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email String email,

        @NotNull Boolean verified
) {}
