package com.asnswap.backend.auth.identity.otp.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import com.asnswap.backend.auth.config.OtpProperties;
import com.asnswap.backend.auth.domain.LoginOtp;
import com.asnswap.backend.auth.identity.otp.notify.OtpNotifier;
import com.asnswap.backend.auth.identity.otp.store.LoginOtpStore;
import com.asnswap.backend.auth.identity.otp.support.EmailNormalizer;
import com.asnswap.backend.auth.identity.otp.support.OtpCodeGenerator;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 OTP 정책 서비스
 *
 * 1) 발급: issue(rawEmail)
 *  - 기존 OTP 전부 삭제 후 새 OTP 저장 (store.replace, 한 트랜잭션)
 *  - 저장이 커밋된 뒤에 OtpNotifier로 전달
 *
 * 2) 검증: verify(rawEmail, code)
 *  - (email, code) 일치 레코드 없음 -> OTP_INVALID ("요청한 적 없음"과 "코드 틀림"을 구분하지 않음)
 *  - 일치 + 만료 -> 해당 이메일 OTP 전부 삭제(커밋) 후 OTP_EXPIRED
 *  - 일치 + 유효 -> compare-and-delete로 소비 후 세션 토큰 발급
 *
 * 이 클래스는 트랜잭션을 열지 않는다. store 호출 하나하나가 독립 커밋이라
 * 만료 판정 후의 삭제가 예외 응답에 휩쓸려 롤백되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginOtpService {

    private final LoginOtpStore otpStore;
    private final OtpNotifier otpNotifier;
    private final OtpCodeGenerator otpCodeGenerator;
    private final JwtService jwtService;
    private final OtpProperties props;
    private final Clock clock;

    public IssuedOtp issue(String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);
        String code = otpCodeGenerator.generate6Digits();
        LocalDateTime expiresAt = now().plusSeconds(props.ttlSeconds());

        replaceWithRetry(email, code, expiresAt);
        log.info("로그인 OTP 발급. email={}, expiresAt={}", email, expiresAt);

        try {
            otpNotifier.sendLoginOtp(email, code, Duration.ofSeconds(props.ttlSeconds()));
        } catch (RuntimeException e) {
            // 코드는 이미 저장됨. 사용자는 재요청하면 된다.
            log.error("로그인 OTP 전달 실패. email={}", email, e);
            throw new ApiException(ErrorCode.SERVICE_UNAVAILABLE, e);
        }

        return new IssuedOtp(email, code, expiresAt);
    }

    public Verified verify(String rawEmail, String code) {
        String email = EmailNormalizer.normalize(rawEmail);

        LoginOtp otp = otpStore.find(email, code)
                .orElseThrow(() -> new ApiException(ErrorCode.OTP_INVALID));

        if (otp.isExpired(now())) {
            // 비교 후 삭제: 그 사이 재발급된 코드는 남긴다.
            otpStore.discard(email, code);
            log.warn("만료된 로그인 OTP 제출. email={}, expiresAt={}", email, otp.getExpiresAt());
            throw new ApiException(ErrorCode.OTP_EXPIRED);
        }

        // 동시에 같은 코드로 들어온 요청 중 먼저 지운 쪽만 통과
        if (!otpStore.consume(email, code)) {
            throw new ApiException(ErrorCode.OTP_INVALID);
        }

        log.info("로그인 OTP 소비. email={}", email);
        return new Verified(email, jwtService.issueSessionToken(email));
    }

    /**
     * [동시 발급 충돌]
     * 같은 email로 replace가 겹치면 한쪽이 email UNIQUE 위반(또는 락 충돌)으로 실패한다.
     * 실패한 쪽은 새 트랜잭션으로 다시 시도한다. 최종적으로 남는 OTP는 항상 1개.
     */
    private void replaceWithRetry(String email, String code, LocalDateTime expiresAt) {
        int maxAttempts = props.issueMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                otpStore.replace(email, code, expiresAt);
                return;
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.error("로그인 OTP 저장 충돌 재시도 초과. email={}, attempts={}", email, attempt, e);
                    throw new ApiException(ErrorCode.SERVICE_UNAVAILABLE, e);
                }
                log.warn("로그인 OTP 저장 충돌, 재시도. email={}, attempt={}", email, attempt);
            }
        }
    }

    // expires_at 비교는 초 단위
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }

    public record IssuedOtp(String email, String code, LocalDateTime expiresAt) {}

    public record Verified(String email, String accessToken) {}
}
