package com.inkblog.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.domain.RefreshToken;
import com.inkblog.backend.auth.token.repo.RefreshTokenRepository;
import com.inkblog.backend.auth.token.support.RefreshTokenSecrets;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh 레코드 저장소 (발급/조회/touch/비활성화/스윕)
 *
 * - DB에는 refresh raw를 저장하지 않고 sha256(token_hash)만 저장한다.
 * - raw는 create()가 딱 한 번 반환하고, 이후 서버는 raw를 다시 만들 수 없다.
 *
 * 동시성:
 * - create는 users row를 SELECT ... FOR UPDATE로 잠근 뒤 쿼터를 계산한다.
 *   같은 유저의 로그인 두 건이 동시에 "자리 있음"을 보고 쿼터를 넘기는 일을 막는다.
 * - touch/deactivate는 조건부 UPDATE의 affected rows(1/0)로 승패를 판정한다.
 *
 * 잠금 순서: users row -> refresh_tokens rows (항상 이 순서)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenStore {

    private final RefreshTokenRepository refreshTokenRepository;
    private final UserRepository userRepository;
    private final RefreshTokenSecrets refreshTokenSecrets;

    private final AuthProperties props;
    private final Clock clock;

    /**
     * 새 refresh 레코드 발급
     * 1) 유저 row 잠금
     * 2) 만료/비활성 레코드 삭제
     * 3) 쿼터 초과분(오래된 순) QUOTA_EVICTED 처리. 새 레코드 포함해서 max개가 남는다.
     * 4) 새 레코드 저장
     */
    @Transactional
    public IssuedRefresh create(Long userId, DeviceInfo device) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        LocalDateTime now = LocalDateTime.now(clock);

        refreshTokenRepository.deleteExpiredOrInactiveByUserId(userId, now);

        int max = props.refresh().maxActivePerUser();
        List<Long> activeIds = refreshTokenRepository.findActiveIdsNewestFirst(userId, now);
        if (activeIds.size() >= max) {
            List<Long> evict = activeIds.subList(max - 1, activeIds.size());
            int evicted = refreshTokenRepository.deactivateAllByIds(evict, now, RefreshRevokeReason.QUOTA_EVICTED);
            log.info("refresh 쿼터 초과로 오래된 세션 정리: userId={}, evicted={}", userId, evicted);
        }

        String raw = refreshTokenSecrets.newRaw();
        if (raw == null || raw.isBlank()) {
            throw new IllegalStateException("generated refresh token is blank");
        }

        LocalDateTime expiresAt = now.plusSeconds(props.refresh().ttlSeconds());
        RefreshToken saved = refreshTokenRepository.save(
                RefreshToken.issue(userId, RefreshTokenSecrets.hashOf(raw), device, now, expiresAt));

        return new IssuedRefresh(raw, saved);
    }

    // token_hash 일치 + active + 미만료
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findActive(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return refreshTokenRepository.findActive(RefreshTokenSecrets.hashOf(raw), LocalDateTime.now(clock));
    }

    // 상태 무관 조회 (로그아웃 멱등 처리용)
    @Transactional(readOnly = true)
    public Optional<RefreshToken> findByRaw(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return refreshTokenRepository.findByTokenHash(RefreshTokenSecrets.hashOf(raw));
    }

    // true = 여전히 사용 가능해서 last_used_at을 갱신함
    @Transactional
    public boolean touch(Long refreshTokenId) {
        return refreshTokenRepository.touchIfUsable(refreshTokenId, LocalDateTime.now(clock)) == 1;
    }

    // true = 이 호출이 active -> inactive 전이를 만들었음 (이미 inactive면 false, 에러 아님)
    @Transactional
    public boolean deactivate(Long refreshTokenId, RefreshRevokeReason reason) {
        return refreshTokenRepository.deactivateIfActive(refreshTokenId, LocalDateTime.now(clock), reason) == 1;
    }

    @Transactional
    public int deactivateAll(Long userId, RefreshRevokeReason reason) {
        return refreshTokenRepository.deactivateAllByUserId(userId, LocalDateTime.now(clock), reason);
    }

    // expires_at <= now 인 레코드 전부 삭제 (RefreshTokenSweeper)
    @Transactional
    public int sweepExpired() {
        return refreshTokenRepository.deleteAllExpired(LocalDateTime.now(clock));
    }

    public record IssuedRefresh(String raw, RefreshToken record) {}
}
