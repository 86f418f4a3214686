package com.asnswap.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.asnswap.backend.auth.identity.me.dto.MeResponse;
import com.asnswap.backend.global.ApiException;
import com.asnswap.backend.global.ErrorCode;
import com.asnswap.backend.security.AuthPrincipal;

/**
 * [내 정보 조회]
 * - JwtAuthenticationFilter가 세션 토큰을 검증하면 principal(AuthPrincipal)이 주입된다.
 * - SecurityConfig에서 막히는 게 정석이지만, principal이 비어 있으면 여기서도 401로 끊는다.
 */
@RestController
@RequestMapping("/api")
public class AuthMeController {

    @GetMapping("/me")
    public MeResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.UNAUTHENTICATED);
        }
        return new MeResponse(principal.email());
    }
}
