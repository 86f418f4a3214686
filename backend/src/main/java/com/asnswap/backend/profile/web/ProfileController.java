package com.asnswap.backend.profile.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.profile.dto.ProfileRequest;
import com.asnswap.backend.profile.dto.ProfileResponse;
import com.asnswap.backend.profile.dto.ProfileSearchResponse;
import com.asnswap.backend.profile.dto.UpsertStatusResponse;
import com.asnswap.backend.profile.service.ProfileService;
import com.asnswap.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 프로필 / 검색 API
 * - POST /api/profile          (인증) 본인 프로필 upsert
 * - GET  /api/profile/{email}  (공개)
 * - GET  /api/search           (공개)
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class ProfileController {

    private final ProfileService profileService;

    @PostMapping("/profile")
    public UpsertStatusResponse upsert(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody ProfileRequest req) {
        if (principal == null) {
            throw new ApiException(ErrorCode.UNAUTHENTICATED);
        }
        return profileService.upsert(principal.email(), req.toFields());
    }

    @GetMapping("/profile/{email}")
    public ProfileResponse get(@PathVariable("email") String email) {
        return profileService.get(email);
    }

    @GetMapping("/search")
    public ProfileSearchResponse search(
            @RequestParam(name = "desired_region", required = false) String desiredRegion,
            @RequestParam(name = "current_region", required = false) String currentRegion,
            @RequestParam(name = "agency", required = false) String agency) {
        return new ProfileSearchResponse(profileService.search(desiredRegion, currentRegion, agency));
    }
}
