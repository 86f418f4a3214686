package com.asnswap.backend.auth.identity.otp.support;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import com.asnswap.backend.auth.config.OtpProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

// expose-debug-code가 켜진 채로 뜨면 기동 로그에 크게 남긴다.
@Slf4j
@Component
@RequiredArgsConstructor
public class DebugCodeExposureWarning {

    private final OtpProperties otpProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void warnIfExposed() {
        if (otpProperties.exposeDebugCode()) {
            log.warn("app.otp.expose-debug-code=true: OTP 원문이 HTTP 응답(debug_code)에 포함된다. 로컬 개발 외에는 끌 것.");
        }
    }
}
