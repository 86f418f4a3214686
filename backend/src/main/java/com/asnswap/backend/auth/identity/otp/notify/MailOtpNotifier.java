package com.asnswap.backend.auth.identity.otp.notify;

import java.time.Duration;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

import com.asnswap.backend.auth.config.AppMailProperties;

import lombok.RequiredArgsConstructor;

/**
 * 로그인 OTP 메일 발송 어댑터
 * - 서비스(정책)는 OtpNotifier만 알고, JavaMailSender는 여기서만 쓴다.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.otp", name = "delivery", havingValue = "mail", matchIfMissing = true)
public class MailOtpNotifier implements OtpNotifier {

    private static final String SUBJECT = "[ASN Swap] Kode login";

    private final JavaMailSender mailSender;
    private final AppMailProperties mailProps;

    @Override
    public void sendLoginOtp(String email, String code, Duration ttl) {
        SimpleMailMessage msg = new SimpleMailMessage();
        msg.setTo(email);
        msg.setFrom(mailProps.from());
        msg.setSubject(SUBJECT);
        msg.setText(buildBody(code, ttl));
        mailSender.send(msg);
    }

    private String buildBody(String code, Duration ttl) {
        return "Kode login Anda: " + code + "\n\n"
                + "Berlaku selama " + ttl.toMinutes() + " menit. Jangan bagikan kode ini kepada siapa pun.";
    }
}
