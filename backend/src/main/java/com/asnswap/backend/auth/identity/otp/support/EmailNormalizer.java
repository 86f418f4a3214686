package com.asnswap.backend.auth.identity.otp.support;

import java.util.Locale;

/**
 * 계정 식별자(email) 정규화
 * - OTP / 토큰 subject / 프로필 / 채팅 전부 같은 키를 쓰도록 경계에서 한 번 맞춘다.
 */
public final class EmailNormalizer {

    private EmailNormalizer() {}

    public static String normalize(String rawEmail) {
        if (rawEmail == null) {
            return null;
        }
        return rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}
