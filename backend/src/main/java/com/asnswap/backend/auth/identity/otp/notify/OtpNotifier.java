package com.asnswap.backend.auth.identity.otp.notify;

import java.time.Duration;

/**
 * OTP 전달 채널 (out-of-band)
 * - 운영: 메일 (MailOtpNotifier)
 * - 로컬 개발: 로그 (LoggingOtpNotifier)
 *
 * app.otp.delivery 값으로 둘 중 하나만 Bean으로 올라온다.
 */
public interface OtpNotifier {

    void sendLoginOtp(String email, String code, Duration ttl);
}
