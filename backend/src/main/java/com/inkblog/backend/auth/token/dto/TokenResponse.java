package com.inkblog.backend.auth.token.dto;

import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.token.service.TokenIssuer.TokenPair;

/**
 * 회원가입/로그인/refresh 공통 응답 바디
 *
 * - accessToken: 매 요청 Authorization: Bearer {accessToken}
 * - refreshToken: 원문은 이 응답에서 딱 한 번만 내려간다. (서버는 해시만 보관)
 *   rotate=true 면 refresh 때마다 값이 바뀌므로 클라이언트는 새 값을 먼저 저장하고 옛 값을 버려야 한다.
 * - expiresIn: access token TTL(초)
 */
public record TokenResponse(
        String accessToken,
        String refreshToken,
        long expiresIn,
        UserSummary user
) {
    public static TokenResponse of(TokenPair pair, User user) {
        return new TokenResponse(
                pair.accessToken(),
                pair.refreshToken(),
                pair.expiresIn(),
                UserSummary.from(user)
        );
    }
}
