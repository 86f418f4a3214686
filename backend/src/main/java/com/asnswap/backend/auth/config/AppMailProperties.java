package com.asnswap.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * app:
 *   mail:
 *     from: ${APP_MAIL_FROM:no-reply@asnswap.id}
 */
@Validated
@ConfigurationProperties(prefix = "app.mail")
public record AppMailProperties(
        @NotBlank @Email String from) {
}
