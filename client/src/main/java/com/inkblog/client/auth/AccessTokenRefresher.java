package com.inkblog.client.auth;

/**
 * refresh token -> 새 access token 교환 (네트워크 호출 1회)
 *
 * 실패는 RefreshFailedException 으로 던진다. 재시도는 하지 않는다.
 */
public interface AccessTokenRefresher {

    TokenResult refresh(String refreshToken);

    /**
     * @param refreshToken 서버가 rotation 하면 새 토큰, 아니면 제출한 토큰 그대로
     * @param expiresInSeconds access token 수명
     */
    record TokenResult(String accessToken, String refreshToken, long expiresInSeconds) {}
}
