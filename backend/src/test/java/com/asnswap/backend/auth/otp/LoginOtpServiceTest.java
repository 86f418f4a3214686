package com.asnswap.backend.auth.otp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

import com.asnswap.backend.auth.domain.LoginOtp;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService.IssuedOtp;
import com.asnswap.backend.auth.identity.otp.service.LoginOtpService.Verified;
import com.asnswap.backend.auth.identity.otp.support.OtpCodeGenerator;
import com.asnswap.backend.auth.support.AuthFixtures;
import com.asnswap.backend.auth.support.CapturingOtpNotifier;
import com.asnswap.backend.auth.support.InMemoryLoginOtpStore;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.infra.TestClockConfig;
import com.asnswap.backend.infra.TestClockConfig.MutableClock;
import com.asnswap.backend.security.JwtService;

/**
 * LoginOtpService 정책 테스트 (DB 없이 InMemoryLoginOtpStore)
 *
 * - issue: 이메일당 1건, 재발급 시 이전 코드 폐기, 저장 충돌 재시도
 * - verify: 1회용, 만료(초 단위, 경계 포함), INVALID/EXPIRED 구분
 */
@DisplayName("[Auth][OTP] LoginOtpService issue/verify")
class LoginOtpServiceTest {

    private static final String EMAIL = "budi@example.go.id";

    private MutableClock clock;
    private InMemoryLoginOtpStore store;
    private CapturingOtpNotifier notifier;
    private JwtService jwtService;
    private LoginOtpService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(TestClockConfig.TEST_START, TestClockConfig.TEST_ZONE);
        store = new InMemoryLoginOtpStore();
        notifier = new CapturingOtpNotifier();
        jwtService = new JwtService(AuthFixtures.authProperties(), clock);
        service = newService(store, sequence(123_456, 654_321, 42));
    }

    @Test
    @DisplayName("issue: 코드 저장 + 알림 전달 + expiresAt = now + 600s")
    void issue_stores_and_notifies() {
        IssuedOtp issued = service.issue(EMAIL);

        assertThat(issued.code()).isEqualTo("123456");
        assertThat(notifier.lastCodeFor(EMAIL)).isEqualTo("123456");
        assertThat(store.outstandingCount(EMAIL)).isEqualTo(1);
        assertThat(issued.expiresAt())
                .isEqualTo(LocalDateTime.now(clock).plusSeconds(AuthFixtures.OTP_TTL_SECONDS));
        assertThat(store.current(EMAIL).orElseThrow().getPurpose().name()).isEqualTo("LOGIN");
    }

    @Test
    @DisplayName("issue 두 번 → 미사용 OTP는 1건, 첫 코드는 더 이상 통하지 않음")
    void reissue_discards_previous_code() {
        String first = service.issue(EMAIL).code();
        String second = service.issue(EMAIL).code();

        assertThat(first).isNotEqualTo(second);
        assertThat(store.outstandingCount(EMAIL)).isEqualTo(1);

        expectError(() -> service.verify(EMAIL, first), ErrorCode.OTP_INVALID);
        assertThat(service.verify(EMAIL, second).accessToken()).isNotBlank();
    }

    @Test
    @DisplayName("issue: 앞자리 0 코드도 그대로 검증된다")
    void zero_padded_code_round_trip() {
        service.issue(EMAIL);
        service.issue(EMAIL);
        String code = service.issue(EMAIL).code(); // sequence 세 번째 = 42

        assertThat(code).isEqualTo("000042");
        assertThat(service.verify(EMAIL, "000042").email()).isEqualTo(EMAIL);
    }

    @Test
    @DisplayName("verify: 만료 판정 직후 재발급이 끼어들면 → OTP_EXPIRED, 새 코드는 지워지지 않는다")
    void expired_verify_keeps_code_reissued_in_between() {
        InMemoryLoginOtpStore racing = new InMemoryLoginOtpStore() {
            private boolean reissued;

            @Override
            public Optional<LoginOtp> find(String email, String code) {
                Optional<LoginOtp> found = super.find(email, code);
                if (!reissued) {
                    // 조회와 삭제 사이에 다른 요청이 새 코드를 발급한 상황
                    reissued = true;
                    replace(email, "777777", LocalDateTime.now(clock).plusSeconds(AuthFixtures.OTP_TTL_SECONDS));
                }
                return found;
            }
        };
        LoginOtpService racingService = newService(racing, sequence(111_111));
        String stale = racingService.issue(EMAIL).code();
        clock.advance(Duration.ofSeconds(AuthFixtures.OTP_TTL_SECONDS + 1));

        expectError(() -> racingService.verify(EMAIL, stale), ErrorCode.OTP_EXPIRED);

        assertThat(racing.current(EMAIL)).hasValueSatisfying(o -> assertThat(o.getCode()).isEqualTo("777777"));
        assertThat(racingService.verify(EMAIL, "777777").email()).isEqualTo(EMAIL);
    }

    @Test
    @DisplayName("verify: 만료 전 정답 → 토큰 발급, 같은 코드 재사용 → OTP_INVALID")
    void verify_is_single_use() {
        String code = service.issue(EMAIL).code();

        Verified ok = service.verify(EMAIL, code);
        assertThat(ok.email()).isEqualTo(EMAIL);
        assertThat(jwtService.verifySessionToken(ok.accessToken())).isEqualTo(EMAIL);
        assertThat(store.outstandingCount(EMAIL)).isZero();

        expectError(() -> service.verify(EMAIL, code), ErrorCode.OTP_INVALID);
    }

    @Test
    @DisplayName("verify: 만료 후 정답 → OTP_EXPIRED + 레코드 삭제, 다시 보내면 OTP_INVALID")
    void verify_after_expiry() {
        String code = service.issue(EMAIL).code();
        clock.advance(Duration.ofSeconds(AuthFixtures.OTP_TTL_SECONDS + 1));

        expectError(() -> service.verify(EMAIL, code), ErrorCode.OTP_EXPIRED);
        assertThat(store.outstandingCount(EMAIL)).isZero();

        expectError(() -> service.verify(EMAIL, code), ErrorCode.OTP_INVALID);
    }

    @Test
    @DisplayName("verify: now == expires_at 경계는 성공")
    void verify_at_exact_expiry_succeeds() {
        String code = service.issue(EMAIL).code();
        clock.advance(Duration.ofSeconds(AuthFixtures.OTP_TTL_SECONDS));

        assertThat(service.verify(EMAIL, code).accessToken()).isNotBlank();
    }

    @Test
    @DisplayName("verify: 경계 + 0.9초(같은 초)는 아직 유효 (초 단위 비교)")
    void verify_compares_at_second_resolution() {
        String code = service.issue(EMAIL).code();
        clock.advance(Duration.ofSeconds(AuthFixtures.OTP_TTL_SECONDS).plusMillis(900));

        assertThat(service.verify(EMAIL, code).email()).isEqualTo(EMAIL);
    }

    @Test
    @DisplayName("verify: 요청 이력 없음 / 코드 틀림 → 둘 다 OTP_INVALID")
    void verify_without_request_or_wrong_code() {
        expectError(() -> service.verify(EMAIL, "123456"), ErrorCode.OTP_INVALID);

        service.issue(EMAIL);
        expectError(() -> service.verify(EMAIL, "999999"), ErrorCode.OTP_INVALID);

        // 틀린 코드는 기존 OTP를 지우지 않는다.
        assertThat(store.outstandingCount(EMAIL)).isEqualTo(1);
    }

    @Test
    @DisplayName("email은 trim + 소문자로 정규화된다")
    void email_is_normalized() {
        String code = service.issue("  Budi@Example.GO.id ").code();

        assertThat(notifier.lastCodeFor(EMAIL)).isEqualTo(code);
        assertThat(service.verify("BUDI@example.go.id", code).email()).isEqualTo(EMAIL);
    }

    @Test
    @DisplayName("verify: 동시 검증에서 compare-and-delete를 놓친 쪽 → OTP_INVALID")
    void verify_loses_consume_race() {
        InMemoryLoginOtpStore racing = new InMemoryLoginOtpStore() {
            @Override
            public boolean consume(String email, String code) {
                // 다른 요청이 먼저 지운 상황
                invalidateAll(email);
                return false;
            }
        };
        LoginOtpService racingService = newService(racing, sequence(111_111));
        String code = racingService.issue(EMAIL).code();

        expectError(() -> racingService.verify(EMAIL, code), ErrorCode.OTP_INVALID);
    }

    @Test
    @DisplayName("issue: 저장 충돌은 재시도 한도 안에서 흡수된다")
    void issue_retries_on_conflict() {
        store.failNextReplaces(2, new DataIntegrityViolationException("uq_login_otp_email"));

        service.issue(EMAIL);

        assertThat(store.replaceCalls()).isEqualTo(3);
        assertThat(store.outstandingCount(EMAIL)).isEqualTo(1);
    }

    @Test
    @DisplayName("issue: 재시도 한도 초과 → SERVICE_UNAVAILABLE, 알림 없음")
    void issue_gives_up_after_max_attempts() {
        store.failNextReplaces(3, new CannotAcquireLockException("deadlock"));

        expectError(() -> service.issue(EMAIL), ErrorCode.SERVICE_UNAVAILABLE);
        assertThat(store.replaceCalls()).isEqualTo(3);
        assertThatThrownBy(() -> notifier.lastCodeFor(EMAIL)).isInstanceOf(AssertionError.class);
    }

    @Test
    @DisplayName("issue: 알림 실패 → SERVICE_UNAVAILABLE, 코드는 저장된 채로 남는다")
    void issue_notifier_failure() {
        notifier.failWith(new IllegalStateException("smtp down"));

        expectError(() -> service.issue(EMAIL), ErrorCode.SERVICE_UNAVAILABLE);
        assertThat(store.current(EMAIL)).isPresent();
    }

    // ---- helpers ----

    private LoginOtpService newService(InMemoryLoginOtpStore s, SecureRandom random) {
        return new LoginOtpService(
                s,
                notifier,
                new OtpCodeGenerator(random),
                jwtService,
                AuthFixtures.otpProperties(false),
                clock);
    }

    // nextInt(bound) 호출마다 values를 순서대로 돌려준다. (끝나면 마지막 값 반복)
    private static SecureRandom sequence(int... values) {
        AtomicInteger idx = new AtomicInteger();
        return new SecureRandom() {
            @Override
            public int nextInt(int bound) {
                int i = Math.min(idx.getAndIncrement(), values.length - 1);
                return values[i];
            }
        };
    }

    private static void expectError(Runnable call, ErrorCode code) {
        assertThatThrownBy(call::run)
                .isInstanceOf(ApiException.class)
                .satisfies(e -> assertThat(((ApiException) e).getErrorCode()).isEqualTo(code));
    }
}
