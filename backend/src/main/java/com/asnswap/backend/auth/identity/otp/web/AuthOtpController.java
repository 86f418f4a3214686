package com.asnswap.backend.auth.identity.otp.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.auth.config.OtpProperties;
import com.asnswap.backend.auth.identity.otp.dto.OtpRequest;
import com.asnswap.backend.auth.identity.otp.dto.OtpRequestResponse;
import com.asnswap.backend.auth.identity.otp.dto.OtpVerifyRequest;
import com.asnswap.backend.auth.identity.otp.dto.TokenResponse;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService.IssuedOtp;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService.Verified;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * OTP 로그인 API
 * - POST /api/auth/request-otp : 코드 발송
 * - POST /api/auth/verify-otp  : 코드 검증 + 세션 토큰 발급
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthOtpController {

    private final LoginOtpService loginOtpService;
    private final OtpProperties otpProperties;

    @PostMapping("/request-otp")
    public OtpRequestResponse requestOtp(@Valid @RequestBody OtpRequest req) {
        IssuedOtp issued = loginOtpService.issue(req.email());
        return OtpRequestResponse.sent(otpProperties.exposeDebugCode() ? issued.code() : null);
    }

    @PostMapping("/verify-otp")
    public TokenResponse verifyOtp(@Valid @RequestBody OtpVerifyRequest req) {
        Verified verified = loginOtpService.verify(req.email(), req.code());
        return TokenResponse.bearer(verified.accessToken(), verified.email());
    }
}
