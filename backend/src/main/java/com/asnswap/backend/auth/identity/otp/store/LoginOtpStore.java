package com.asnswap.backend.auth.identity.otp.store;

import java.time.LocalDateTime;
import java.util.Optional;

import com.asnswap.backend.auth.domain.LoginOtp;

/**
 * 미사용 로그인 OTP 저장소
 *
 * 구현체는 각 메서드를 독립된 트랜잭션으로 커밋한다.
 * - 만료 판정 후의 삭제가 예외 응답과 무관하게 DB에 남아야 하기 때문
 */
public interface LoginOtpStore {

    /**
     * 이메일의 기존 OTP를 모두 지우고 새 OTP 1건을 저장한다. (한 트랜잭션)
     * - 동시 발급 충돌 시 DataIntegrityViolationException / ConcurrencyFailureException
     */
    LoginOtp replace(String email, String code, LocalDateTime expiresAt);

    Optional<LoginOtp> find(String email, String code);

    /**
     * (email, code)가 남아있으면 그 이메일의 OTP를 전부 지우고 true.
     * 다른 요청이 먼저 소비했다면 false.
     */
    boolean consume(String email, String code);

    /**
     * (email, code) 행 하나만 지운다. 그 사이 재발급된 새 코드는 건드리지 않는다.
     */
    boolean discard(String email, String code);

    int invalidateAll(String email);
}
