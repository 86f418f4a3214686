package com.asnswap.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.asnswap.backend.auth.config.AuthModuleConfig;

/*
================================================================================
[로컬 실행]
================================================================================
SPRING_PROFILES_ACTIVE=local ./mvnw -pl backend spring-boot:run
- local 프로필: OTP는 메일 대신 로그로 출력(app.otp.delivery=log)

================================================================================
[curl 시나리오 테스트]  (OTP 요청 -> 검증 -> /api/me)
================================================================================
# OTP 요청 200
curl -i -X POST "http://localhost:8080/api/auth/request-otp" \
  -H "Content-Type: application/json" \
  -d '{"email":"budi@example.go.id"}'

# OTP 검증 200 (로그/메일에서 본 코드로)
curl -i -X POST "http://localhost:8080/api/auth/verify-otp" \
  -H "Content-Type: application/json" \
  -d '{"email":"budi@example.go.id","code":"123456"}'
- 응답의 access_token을 아래 Bearer에 넣는다.
- 같은 코드로 한 번 더 보내면 400 OTP_INVALID (1회용)

# 내 정보
curl -i "http://localhost:8080/api/me" -H "Authorization: Bearer <access_token>"
- 만료/서명불일치/형식오류 전부 401 UNAUTHENTICATED

# 프로필 등록/수정 (email은 토큰 기준으로 강제됨)
curl -i -X POST "http://localhost:8080/api/profile" \
  -H "Authorization: Bearer <access_token>" -H "Content-Type: application/json" \
  -d '{"name":"Budi","agency":"Kemenkeu","position":"Analis","grade":"III/a","current_region":"Jakarta","desired_region":"Bandung"}'

# 검색
curl -i "http://localhost:8080/api/search?desired_region=bandung"
*/

/**
 * 엔트리포인트
 * - com.asnswap.backend 하위 패키지(auth, security, profile, chat, admin, payment, global)를 컴포넌트 스캔한다.
 *
 * UserDetailsServiceAutoConfiguration 제외
 * - JWT 방식이라 기본 인메모리 유저("Using generated security password")가 필요 없다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
