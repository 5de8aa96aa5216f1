package com.inkblog.backend.auth.token.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.token.service.RefreshTokenStore.IssuedRefresh;
import com.inkblog.backend.security.JwtService;

import lombok.RequiredArgsConstructor;

/**
 * 인증이 끝난 사용자에게 access + refresh 한 쌍을 발급한다.
 * (로그인/회원가입/refresh 로테이션 공통)
 *
 * - access token의 role/emailVerified는 "발급 시점" 값이다.
 * - refresh 레코드는 호출당 정확히 1개 생긴다.
 */
@Service
@RequiredArgsConstructor
public class TokenIssuer {

    private final JwtService jwtService;
    private final RefreshTokenStore refreshTokenStore;

    @Transactional
    public TokenPair issueTokenPair(User user, DeviceInfo device) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("user must be persisted");
        }

        // create()의 벌크 연산이 영속성 컨텍스트를 비우므로 user 값은 먼저 읽어둔다.
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getRole(), user.isEmailVerified());
        IssuedRefresh refresh = refreshTokenStore.create(user.getId(), device);

        return new TokenPair(accessToken, refresh.raw(), jwtService.accessTtlSeconds());
    }

    public record TokenPair(String accessToken, String refreshToken, long expiresIn) {}
}
