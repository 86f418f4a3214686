package com.asnswap.backend.security;

import com.asnswap.backend.auth.domain.UserRole;

/**
 * SecurityContext에 저장되는 "인증된 사용자" 정보
 * - email: 토큰 subject. 프로필 저장/채팅 발신자는 항상 이 값으로 강제된다.
 * - role: 관리자 목록(app.admin.emails) 기준으로 인증 시점에 결정
 */
public record AuthPrincipal(String email, UserRole role) {

    public AuthPrincipal {
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email must not be blank");
        if (role == null) throw new IllegalArgumentException("role must not be null");
    }

    /** Spring Security 권한 문자열 규칙(ROLE_*) */
    public String authority() {
        return "ROLE_" + role.name();
    }

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
