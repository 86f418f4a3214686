package com.asnswap.backend.security;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * 브라우저 프론트엔드용 CORS 설정
 *
 * app:
 *   cors:
 *     allowed-origins: ${APP_CORS_ALLOWED_ORIGINS:${FRONTEND_URL:http://localhost:3000}}
 *     max-age: PT1H
 *
 * - origin 패턴 허용 ("https://*.asnswap.id", "*")
 * - 인증은 Authorization 헤더만 쓰므로 credentials(쿠키)는 허용하지 않는다.
 */
@Validated
@ConfigurationProperties(prefix = "app.cors")
public record CorsProperties(
        @NotEmpty List<String> allowedOrigins,
        @NotNull Duration maxAge
) {

    public CorsProperties {
        allowedOrigins = allowedOrigins == null
                ? List.of()
                : allowedOrigins.stream()
                        .filter(o -> o != null && !o.isBlank())
                        .map(String::trim)
                        .toList();
    }
}
