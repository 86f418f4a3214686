package com.asnswap.backend.admin.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.asnswap.backend.auth.identity.otp.store.LoginOtpStore;
import com.asnswap.backend.auth.identity.otp.support.EmailNormalizer;
import com.asnswap.backend.chat.repo.ChatMessageRepository;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.profile.domain.UserProfile;
import com.asnswap.backend.profile.dto.ProfileResponse;
import com.asnswap.backend.profile.repo.UserProfileRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 관리자 기능
 * - 권한 체크는 SecurityConfig(hasRole ADMIN)에서 끝난 상태로 들어온다.
 * - adminEmail은 감사 로그용
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final UserProfileRepository profileRepository;
    private final ChatMessageRepository messageRepository;
    private final LoginOtpStore otpStore;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<ProfileResponse> listUsers() {
        return profileRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(ProfileResponse::from)
                .toList();
    }

    @Transactional
    public void setVerified(String adminEmail, String rawEmail, boolean verified) {
        String email = EmailNormalizer.normalize(rawEmail);
        UserProfile profile = profileRepository.findByEmail(email)
                .orElseThrow(() -> new ApiException(ErrorCode.PROFILE_NOT_FOUND));

        profile.changeVerified(verified, LocalDateTime.now(clock));
        log.info("관리자 인증 플래그 변경. admin={}, email={}, verified={}", adminEmail, email, verified);
    }

    /**
     * 계정 삭제
     * - 프로필 + 보내고 받은 메시지 전부 + 남아있는 로그인 OTP
     * - 이미 발급된 세션 토큰은 만료 전까지 살아있다. (서버에 토큰 상태가 없음)
     */
    @Transactional
    public void deleteUser(String adminEmail, String rawEmail) {
        String email = EmailNormalizer.normalize(rawEmail);

        int profiles = profileRepository.deleteByEmail(email);
        int messages = messageRepository.deleteAllInvolving(email);
        otpStore.invalidateAll(email);

        log.info("관리자 계정 삭제. admin={}, email={}, profiles={}, messages={}", adminEmail, email, profiles, messages);
    }
}
