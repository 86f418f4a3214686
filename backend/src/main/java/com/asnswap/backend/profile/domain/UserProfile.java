package com.asnswap.backend.profile.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * ASN 사용자 프로필
 * - email이 계정 키 (토큰 subject와 같은 값)
 * - isSubscribed / isVerified 는 본인이 바꿀 수 없다. (결제/관리자 경로 전용)
 */
@Entity
@Table(name = "user_profile",
       uniqueConstraints = @UniqueConstraint(name = "uq_user_profile_email", columnNames = "email"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String email;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 30)
    private String nip; // 공무원 번호 (선택)

    @Column(nullable = false, length = 150)
    private String agency; // 소속 기관

    @Column(nullable = false, length = 100)
    private String position;

    @Column(nullable = false, length = 20)
    private String grade;

    @Column(name = "current_region", nullable = false, length = 100)
    private String currentRegion;

    @Column(name = "desired_region", nullable = false, length = 100)
    private String desiredRegion;

    @Column(name = "is_subscribed", nullable = false)
    private boolean subscribed;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static UserProfile create(String email, ProfileFields fields, LocalDateTime now) {
        UserProfile p = new UserProfile();
        p.email = email;
        p.apply(fields);
        p.subscribed = false;
        p.verified = false;
        p.createdAt = now;
        p.updatedAt = now;
        return p;
    }

    public void update(ProfileFields fields, LocalDateTime now) {
        apply(fields);
        this.updatedAt = now;
    }

    public void changeVerified(boolean verified, LocalDateTime now) {
        this.verified = verified;
        this.updatedAt = now;
    }

    private void apply(ProfileFields f) {
        this.name = f.name();
        this.nip = f.nip();
        this.agency = f.agency();
        this.position = f.position();
        this.grade = f.grade();
        this.currentRegion = f.currentRegion();
        this.desiredRegion = f.desiredRegion();
    }
}
