package com.asnswap.backend.auth.identity.otp.store;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.asnswap.backend.auth.domain.LoginOtp;
import com.asnswap.backend.auth.repo.LoginOtpRepository;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class JpaLoginOtpStore implements LoginOtpStore {

    private final LoginOtpRepository loginOtpRepository;

    /**
     * [동시 발급]
     * - 같은 email로 두 트랜잭션이 동시에 들어오면 한쪽은 email UNIQUE(또는 락 대기 후 데드락 감지)로 실패한다.
     * - 실패한 쪽은 예외가 그대로 올라가고, 재시도 여부는 LoginOtpService가 정한다.
     */
    @Override
    @Transactional
    public LoginOtp replace(String email, String code, LocalDateTime expiresAt) {
        loginOtpRepository.deleteAllByEmail(email);
        return loginOtpRepository.saveAndFlush(LoginOtp.create(email, code, expiresAt));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<LoginOtp> find(String email, String code) {
        return loginOtpRepository.findByEmailAndCode(email, code);
    }

    @Override
    @Transactional
    public boolean consume(String email, String code) {
        int deleted = loginOtpRepository.deleteByEmailAndCode(email, code);
        if (deleted == 0) {
            return false;
        }
        // UNIQUE라 남은 행은 없어야 정상. 혹시 남아있으면 같이 정리한다.
        loginOtpRepository.deleteAllByEmail(email);
        return true;
    }

    @Override
    @Transactional
    public boolean discard(String email, String code) {
        return loginOtpRepository.deleteByEmailAndCode(email, code) > 0;
    }

    @Override
    @Transactional
    public int invalidateAll(String email) {
        return loginOtpRepository.deleteAllByEmail(email);
    }
}
