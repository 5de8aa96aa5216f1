package com.inkblog.backend.auth.token.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import com.inkblog.backend.auth.device.DeviceClass;
import com.inkblog.backend.auth.device.DeviceInfo;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * refresh_tokens 매핑 엔티티
 * 
 * row 하나 = 기기 하나의 로그인 세션. access token(JWT)은 저장하지 않는다.
 *
 * 1) refresh raw(원문)은 DB에 절대 저장하지 않는다. (token_hash만 저장)
 * 2) refresh에 쓸 수 있는 건 active = true AND now < expires_at 인 row뿐이다.
 * 3) active는 true -> false 한 방향으로만 바뀐다.
 *    상태 전이는 엔티티 메서드가 아니라 RefreshTokenRepository의 조건부 UPDATE(where active = true)로만 한다.
 *    동시에 두 요청이 같은 row를 바꿔도 affected rows로 승자가 하나로 정해진다.
 * 
 * 인덱스:
 * @Index: idx_refresh_token_hash 
 *  - token_hash: 요청 바디의 refresh 토큰 원문을 해싱한 값 = 조회 키 (유니크)
 * @Index: idx_refresh_user_active
 *  - (user_id, active): 유저 단위 쿼터 계산/전체 로그아웃
 * @Index: idx_refresh_expires_at
 *  - 만료 레코드 스윕(RefreshTokenSweeper)
 */
@Getter
@Entity
@Table(
    name = "refresh_tokens",
    indexes = {
        @Index(name = "idx_refresh_token_hash", columnList = "token_hash", unique = true),
        @Index(name = "idx_refresh_user_active", columnList = "user_id, active"),
        @Index(name = "idx_refresh_expires_at", columnList = "expires_at")
    }
)
@NoArgsConstructor(access=AccessLevel.PROTECTED) // JPA가 리플렉션으로 객체 생성
public class RefreshToken {

    // ---- constants (DB 제약과 반드시 맞춰야 함) ----
    public static final int TOKEN_HASH_LEN = 64;      // sha256 hex
    public static final int USER_AGENT_MAX = 255;
    public static final int IP_ADDRESS_MAX = 45;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId; 

    // sha256 hex(64). raw 저장 금지.
    @Column(name = "token_hash", nullable = false, length = TOKEN_HASH_LEN, columnDefinition = "char(64)")
    private String tokenHash;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    // ---- ops / security telemetry ----
    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "revoked_at")
    private LocalDateTime revokedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "revoke_reason", length = 50)
    private RefreshRevokeReason revokeReason;

    @Column(name = "user_agent", length = USER_AGENT_MAX)
    private String userAgent;

    @Column(name = "ip_address", length = IP_ADDRESS_MAX)
    private String ipAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_class", nullable = false, length = 20)
    private DeviceClass deviceClass;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;


    
    /**
     * 새 세션 레코드 (active=true). RefreshTokenStore.create 에서만 만든다.
     * User-Agent / IP 는 컬럼 길이에 맞춰 자르고, 빈 값은 null 로 저장한다.
     */
    public static RefreshToken issue(Long userId, String tokenHash, DeviceInfo device,
                                     LocalDateTime now, LocalDateTime expiresAt) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        if (!expiresAt.isAfter(now)) {
            throw new IllegalArgumentException("expiresAt must be after now");
        }
        if (!isSha256Hex(tokenHash)) {
            throw new IllegalArgumentException("tokenHash must be lowercase sha256 hex");
        }

        DeviceInfo d = (device == null) ? DeviceInfo.unknown() : device;

        RefreshToken rt = new RefreshToken();
        rt.userId = userId;
        rt.tokenHash = tokenHash;
        rt.active = true;
        rt.createdAt = now;
        rt.expiresAt = expiresAt;
        rt.userAgent = clip(d.userAgent(), USER_AGENT_MAX);
        rt.ipAddress = clip(d.ipAddress(), IP_ADDRESS_MAX);
        rt.deviceClass = d.deviceClass();
        return rt;
    }

    private static boolean isSha256Hex(String h) {
        if (h == null || h.length() != TOKEN_HASH_LEN) return false;
        for (int i = 0; i < h.length(); i++) {
            char c = h.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
            if (!hex) return false;
        }
        return true;
    }

    private static String clip(String v, int max) {
        if (v == null || v.isBlank()) return null;
        String t = v.strip();
        return t.length() <= max ? t : t.substring(0, max);
    }
}
