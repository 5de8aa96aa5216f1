package com.inkblog.backend.auth.identity.password.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import com.inkblog.backend.auth.device.DeviceInfo;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * password_resets 매핑 엔티티
 *
 * row 하나 = 메일로 나간 재설정 링크 하나.
 * - 링크의 토큰 원문은 저장하지 않는다. (token_hash = sha256 hex)
 * - 쓸 수 있는 건 used_at IS NULL AND now < expires_at 인 row뿐이다.
 * - used_at 은 null -> 시각 한 방향으로만 바뀐다. 바꾸는 건 PasswordResetRepository의 조건부 UPDATE뿐.
 * - (user_id, created_at) 인덱스: 시간당 요청 횟수 제한 계산
 */
@Getter
@Entity
@Table(
    name = "password_resets",
    indexes = {
        @Index(name = "idx_password_reset_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_password_reset_user_created", columnList = "user_id, created_at")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PasswordReset {

    public static final int TOKEN_HASH_LEN = 64;
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "used_at")
    private LocalDateTime usedAt; // null이면 아직 사용 가능(만료 전이라면)

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static PasswordReset issue(Long userId, String tokenHash, DeviceInfo requestedFrom,
                                      LocalDateTime now, LocalDateTime expiresAt) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(tokenHash, "tokenHash must not be null");
        if (tokenHash.length() != TOKEN_HASH_LEN) {
            throw new IllegalArgumentException("tokenHash must be sha256 hex");
        }
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("expiresAt must be after now");
        }

        DeviceInfo d = (requestedFrom == null) ? DeviceInfo.unknown() : requestedFrom;

        PasswordReset pr = new PasswordReset();
        pr.userId = userId;
        pr.tokenHash = tokenHash;
        pr.expiresAt = expiresAt;
        pr.usedAt = null;
        pr.userAgent = clip(d.userAgent(), USER_AGENT_MAX);
        pr.ipAddress = clip(d.ipAddress(), IP_ADDRESS_MAX);
        pr.createdAt = now;
        return pr;
    }

    private static String clip(String v, int max) {
        if (v == null || v.isBlank()) return null;
        String t = v.strip();
        return t.length() <= max ? t : t.substring(0, max);
    }
}
