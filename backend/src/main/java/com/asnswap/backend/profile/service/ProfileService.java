package com.asnswap.backend.profile.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.asnswap.backend.auth.identity.otp.support.EmailNormalizer;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.profile.domain.ProfileFields;
import com.asnswap.backend.profile.domain.UserProfile;
import com.asnswap.backend.profile.dto.ProfileResponse;
import com.asnswap.backend.profile.dto.UpsertStatusResponse;
import com.asnswap.backend.profile.repo.UserProfileRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 프로필 서비스
 *
 * 1) upsert(actorEmail, fields): 본인 프로필 생성 또는 수정
 *  - actorEmail은 토큰에서 꺼낸 값만 받는다.
 * 2) get(email): 공개 조회. 없으면 PROFILE_NOT_FOUND
 * 3) search(...): 공개 검색. 필터는 대소문자 무시 부분 일치
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final UserProfileRepository profileRepository;
    private final Clock clock;

    @Transactional
    public UpsertStatusResponse upsert(String actorEmail, ProfileFields fields) {
        LocalDateTime now = LocalDateTime.now(clock);

        UserProfile existing = profileRepository.findByEmail(actorEmail).orElse(null);
        if (existing != null) {
            existing.update(fields, now); // 더티체킹으로 커밋 시 반영
            return UpsertStatusResponse.updated();
        }

        try {
            profileRepository.saveAndFlush(UserProfile.create(actorEmail, fields, now));
        } catch (DataIntegrityViolationException e) {
            // 같은 사용자의 동시 최초 저장. email UNIQUE가 한 건만 남긴다.
            log.warn("프로필 동시 생성 충돌. email={}", actorEmail);
            throw new ApiException(ErrorCode.SERVICE_UNAVAILABLE, e);
        }
        log.info("프로필 생성. email={}", actorEmail);
        return UpsertStatusResponse.created();
    }

    @Transactional(readOnly = true)
    public ProfileResponse get(String rawEmail) {
        return profileRepository.findByEmail(EmailNormalizer.normalize(rawEmail))
                .map(ProfileResponse::from)
                .orElseThrow(() -> new ApiException(ErrorCode.PROFILE_NOT_FOUND));
    }

    @Transactional(readOnly = true)
    public List<ProfileResponse> search(String desiredRegion, String currentRegion, String agency) {
        return profileRepository.search(
                        containsPattern(desiredRegion),
                        containsPattern(currentRegion),
                        containsPattern(agency))
                .stream()
                .map(ProfileResponse::from)
                .toList();
    }

    /**
     * 빈 값 -> null (필터 없음)
     * 그 외 -> "%값%" (LIKE 와일드카드 문자는 '!'로 이스케이프)
     */
    static String containsPattern(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String escaped = raw.trim().toLowerCase(Locale.ROOT)
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
        return "%" + escaped + "%";
    }
}
