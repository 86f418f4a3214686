package com.asnswap.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/*
  app.auth.* 바인딩

  app:
    auth:
      jwt:
        issuer: asn-swap
        ttl-seconds: 604800   # 7일
        secret: ${APP_AUTH_JWT_SECRET:?set APP_AUTH_JWT_SECRET}
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt) {

    /**
     * 세션 토큰(JWT) 설정
     * - issuer: 토큰 발급자 식별자 (검증 시 requireIssuer)
     * - ttlSeconds: 토큰 수명. 서버에 상태가 없으므로 만료 전 강제 폐기는 불가능하다.
     * - secret: HS256 서명 키 (32바이트 이상)
     */
    public record Jwt(
            @NotBlank String issuer,
            @Min(1) long ttlSeconds,
            @NotBlank @Size(min = 32) String secret
    ) {}
}
