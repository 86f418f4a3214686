package com.asnswap.backend.auth.identity.otp.support;

import java.security.SecureRandom;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class OtpCodeGenerator {

    private final SecureRandom secureRandom;

    public String generate6Digits() {
        int n = secureRandom.nextInt(1_000_000); // 0~999999, 100만 개 균등
        return String.format("%06d", n);         // 000000~999999
    }
}
