package com.asnswap.backend.auth.identity.otp.notify;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

// 로컬 개발 전용. 코드 원문이 로그에 남으므로 운영 프로필에서 delivery=log 금지.
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.otp", name = "delivery", havingValue = "log")
public class LoggingOtpNotifier implements OtpNotifier {

    @Override
    public void sendLoginOtp(String email, String code, Duration ttl) {
        log.info("[DEV] 로그인 OTP email={}, code={}, ttl={}s", email, code, ttl.toSeconds());
    }
}
