package com.inkblog.backend.auth.token.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 종료(refresh 비활성화)
 *
 * - logout(raw): 레코드 1개만 LOGOUT 처리. 없음/이미 비활성/빈 값이어도 에러 없이 끝난다(멱등).
 * - logoutAll(userId): 유저의 active 레코드 전부 비활성화 (모든 기기 로그아웃, 비밀번호 변경)
 *
 * access token은 저장소가 없으므로 여기서 끊을 수 없다.
 * 남은 TTL 동안은 AccessTokenAuthenticator의 상태 검사(비활성/잠금/비밀번호 변경)만 적용된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RevocationService {

    private final RefreshTokenStore refreshTokenStore;
    private final UserRepository userRepository;

    @Transactional
    public void logout(String refreshRaw) {
        refreshTokenStore.findByRaw(refreshRaw).ifPresent(token -> {
            if (refreshTokenStore.deactivate(token.getId(), RefreshRevokeReason.LOGOUT)) {
                log.info("로그아웃: userId={}, refreshId={}", token.getUserId(), token.getId());
            }
        });
    }

    /**
     * 유저 row를 먼저 잠가서 같은 유저의 로그인/refresh(create)와 순서를 맞춘다.
     * @return 비활성화된 레코드 수
     */
    @Transactional
    public int logoutAll(Long userId, RefreshRevokeReason reason) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");

        if (userRepository.findByIdForUpdate(userId).isEmpty()) {
            return 0;
        }

        int revoked = refreshTokenStore.deactivateAll(userId, reason);
        log.info("전체 세션 종료: userId={}, reason={}, revoked={}", userId, reason, revoked);
        return revoked;
    }
}
