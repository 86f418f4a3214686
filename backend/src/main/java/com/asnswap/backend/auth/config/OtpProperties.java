package com.asnswap.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * 로그인 OTP 정책 설정
 *
 * app:
 *   otp:
 *     ttl-seconds: 600
 *     delivery: mail            # mail | log
 *     expose-debug-code: false  # 로컬 개발 전용. 운영에서 켜면 안 된다.
 *     issue-max-attempts: 3     # 동시 발급 충돌 시 재시도 횟수
 */
@Validated
@ConfigurationProperties(prefix = "app.otp")
public record OtpProperties(
        @Min(1) long ttlSeconds,
        @NotNull Delivery delivery,
        boolean exposeDebugCode,
        @Min(1) @Max(10) int issueMaxAttempts
) {

    public enum Delivery {
        mail, log
    }
}
