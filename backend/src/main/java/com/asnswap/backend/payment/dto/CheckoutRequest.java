package com.asnswap.backend.payment.dto;

import com.asnswap.backend.global.jackson.TrimStringDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record CheckoutRequest(
        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank
        @Email String email
) {}
