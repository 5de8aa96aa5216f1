package com.inkblog.backend.auth.domain;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

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
import lombok.NoArgsConstructor;

/**
 * users 테이블 = "회원 저장소"
 * 
 * 세션(토큰) 관점에서 쓰이는 필드:
 * - status: ACTIVE가 아니면 로그인/refresh/보호 API 전부 차단
 * - passwordChangedAt: 이 시각 "이전"에 발급된 access token은 서명이 유효해도 거부 (PASSWORD_CHANGED)
 * - failedLoginAttempts / lockUntil: 연속 로그인 실패 잠금
 * 
 * 불변 조건:
 * - isLocked(now) == (lockUntil != null && lockUntil > now)
 */
@Entity
@Table(name = "users", uniqueConstraints = {
        @UniqueConstraint(name = "uq_users_email", columnNames = "email"),
        @UniqueConstraint(name = "uq_users_nickname", columnNames = "nickname")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id; // PK. JWT의 sub(subject)로 쓰임(userId)

    @Column(nullable = false, length = 255)
    private String email; // 로그인 ID (Unique)

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash; // 비밀번호를 BCrypt된 해시로 저장 (원문 저장 금지)

    @Column(nullable = false, length = 30) 
    private String nickname; // 블로그 표시명. 유니크

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role; // JWT에 실어서 인가(권한 체크)에 씀

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserStatus status;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified; // JWT emailVerified 클레임

    @Column(name = "password_changed_at")
    private LocalDateTime passwordChangedAt; // 가입 직후엔 null (비교 대상 없음)

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "lock_until")
    private LocalDateTime lockUntil;

    @Column(name = "last_login_at")
    private LocalDateTime lastLoginAt; // 운영/보안용(마지막 로그인)

    // 가입 시 생성 (RegisterService.register()에서 호출)
    public static User create(String email, String passwordHash, String nickname) {
        User u = new User();
        u.email = email;
        u.passwordHash = passwordHash;
        u.nickname = nickname;

        // 기본 정책값
        u.role = UserRole.USER;
        u.status = UserStatus.ACTIVE;
        u.emailVerified = true; // 메일 인증 플로우가 없어 가입 즉시 인증 처리
        u.failedLoginAttempts = 0;
        u.lockUntil = null;
        u.passwordChangedAt = null;
        u.lastLoginAt = null;
        return u;
    }

    // ========= domain =========

    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }

    public boolean isLocked(LocalDateTime now) {
        return lockUntil != null && lockUntil.isAfter(now);
    }

    // Retry-After 용. 잠겨있지 않으면 0
    public long secondsUntilUnlock(LocalDateTime now) {
        if (!isLocked(now)) return 0L;
        return Math.max(1L, Duration.between(now, lockUntil).toSeconds());
    }

    /**
     * 토큰 발급(iat) 이후 비밀번호가 바뀌었는지
     * - JWT iat은 초 단위라서 passwordChangedAt도 초 단위로 내려서 비교한다.
     * - 같은 초에 발급된 토큰은 통과 (변경 직후 재로그인 토큰이 막히지 않도록)
     */
    public boolean changedPasswordAfter(Instant issuedAt, ZoneId zone) {
        if (passwordChangedAt == null) return false;
        Objects.requireNonNull(issuedAt, "issuedAt must not be null");

        long changedEpochSecond = passwordChangedAt.atZone(zone).toEpochSecond();
        return issuedAt.getEpochSecond() < changedEpochSecond;
    }

    /**
     * 비밀번호 불일치 1회 기록
     * - 이전 잠금이 이미 풀린 상태라면 카운터를 1부터 다시 센다.
     * - 누적 실패가 maxAttempts에 도달하면 lockUntil = now + lockDuration
     * 
     * @return 이번 호출로 잠금이 걸렸으면 true
     */
    public boolean registerLoginFailure(LocalDateTime now, int maxAttempts, long lockDurationSeconds) {
        if (lockUntil != null && !lockUntil.isAfter(now)) {
            failedLoginAttempts = 1;
            lockUntil = null;
            return false;
        }

        failedLoginAttempts++;
        if (failedLoginAttempts >= maxAttempts && !isLocked(now)) {
            lockUntil = now.plusSeconds(lockDurationSeconds);
            return true;
        }
        return false;
    }

    public void resetLoginFailures() {
        failedLoginAttempts = 0;
        lockUntil = null;
    }

    public void changePassword(String newPasswordHash, LocalDateTime now) {
        this.passwordHash = Objects.requireNonNull(newPasswordHash, "newPasswordHash must not be null");
        this.passwordChangedAt = now;
        resetLoginFailures();
    }

    public void setLastLoginAt(LocalDateTime now) {
        lastLoginAt = now;
    }

    public Long getId() {return id;}
    public UserStatus getStatus() {return status;}
    public UserRole getRole() {return role;}
    public String getPasswordHash() {return passwordHash;}
    public String getEmail() {return email;}
    public String getNickname() {return nickname;}
    public boolean isEmailVerified() {return emailVerified;}
    public LocalDateTime getPasswordChangedAt() {return passwordChangedAt;}
    public int getFailedLoginAttempts() {return failedLoginAttempts;}
    public LocalDateTime getLockUntil() {return lockUntil;}
    public LocalDateTime getLastLoginAt() {return lastLoginAt;}
}
