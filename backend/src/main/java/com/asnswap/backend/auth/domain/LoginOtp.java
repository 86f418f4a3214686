package com.asnswap.backend.auth.domain;

import java.time.LocalDateTime;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 로그인 OTP 레코드
 *
 * email UNIQUE
 * - 이메일당 미사용 OTP는 항상 최대 1개
 * - 동시 발급 레이스는 이 제약이 최종 승자를 정한다.
 *
 * 레코드는 불변이다. (setter/갱신 메서드 없음)
 * - 재발급 = 기존 행 삭제 후 새 행 삽입
 * - 검증 성공/만료 판정 = 행 삭제
 */
@Entity
@Table(name = "login_otp",
       uniqueConstraints = @UniqueConstraint(name = "uq_login_otp_email", columnNames = "email"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoginOtp {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email; // 정규화된 이메일 (trim + lowercase)

    @Column(nullable = false, length = 6)
    private String code; // 6자리 숫자 문자열 (앞자리 0 포함)

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.VARCHAR) // MySQL native ENUM 말고 VARCHAR(20)
    @Column(nullable = false, length = 20)
    private OtpPurpose purpose;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt; // 초 단위로 잘라서 저장

    public static LoginOtp create(String email, String code, LocalDateTime expiresAt) {
        LoginOtp o = new LoginOtp();
        o.email = email;
        o.code = code;
        o.purpose = OtpPurpose.LOGIN;
        o.expiresAt = expiresAt;
        return o;
    }

    // now == expiresAt 은 아직 유효하다.
    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }
}
