package com.asnswap.backend.auth.config;

import java.util.List;
import java.util.Locale;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 관리자 계정 목록
 *
 * app:
 *   admin:
 *     emails: ${APP_ADMIN_EMAILS:}
 *
 * - 토큰에는 subject(email)만 싣고, 관리자 여부는 인증 시점에 이 목록으로 판정한다.
 *   (목록에서 빼면 다음 요청부터 바로 권한이 사라진다)
 */
@Validated
@ConfigurationProperties(prefix = "app.admin")
public record AdminProperties(List<String> emails) {

    public AdminProperties {
        emails = emails == null
                ? List.of()
                : emails.stream()
                        .filter(e -> e != null && !e.isBlank())
                        .map(e -> e.trim().toLowerCase(Locale.ROOT))
                        .toList();
    }

    public boolean isAdmin(String email) {
        return email != null && emails.contains(email.toLowerCase(Locale.ROOT));
    }
}
