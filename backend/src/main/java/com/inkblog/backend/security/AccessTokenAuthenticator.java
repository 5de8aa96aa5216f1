package com.inkblog.backend.security;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.security.JwtService.AccessClaims;

import lombok.RequiredArgsConstructor;

/**
 * 보호 API 요청마다 Access Token을 "사용 가능한 인증"으로 바꾸는 검증기
 *
 * 판정 순서 (앞에서 걸리면 바로 종료):
 * 1) 서명/iss/aud/exp 검증 실패        -> TOKEN_INVALID
 * 2) sub(userId)에 해당하는 유저 없음   -> USER_NOT_FOUND (메시지는 TOKEN_INVALID와 동일)
 * 3) 비활성 계정                        -> ACCOUNT_DEACTIVATED
 * 4) 로그인 실패 잠금 중                -> ACCOUNT_LOCKED
 * 5) 토큰 발급(iat) 이후 비밀번호 변경  -> PASSWORD_CHANGED
 * 6) 통과 -> AuthPrincipal
 *
 * - role은 DB가 아니라 토큰 값을 그대로 쓴다. 권한 변경은 토큰 만료/재로그인/refresh 시점에 반영된다.
 * - access token은 DB에 저장/폐기 목록이 없다. 로그아웃해도 남은 TTL 동안은 1~5단계만 막을 수 있다.
 */
@Service
@RequiredArgsConstructor
public class AccessTokenAuthenticator {

    private static final String EXPIRED_MESSAGE = "엑세스 토큰이 만료되었습니다.";

    private final JwtService jwtService;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AuthPrincipal authenticate(String accessToken) {
        AccessClaims claims = verify(accessToken);

        User user = userRepository.findById(claims.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DEACTIVATED);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (user.isLocked(now)) {
            throw ApiException.accountLocked(user.secondsUntilUnlock(now));
        }

        if (user.changedPasswordAfter(claims.issuedAt(), clock.getZone())) {
            throw new ApiException(ErrorCode.PASSWORD_CHANGED);
        }

        return new AuthPrincipal(user.getId(), claims.role());
    }

    // 만료는 코드(TOKEN_INVALID)는 같고 메시지만 다르게
    private AccessClaims verify(String accessToken) {
        try {
            return jwtService.verifyAccessToken(accessToken);
        } catch (JwtService.InvalidJwtException e) {
            if (e.isExpired()) {
                throw new ApiException(ErrorCode.TOKEN_INVALID, EXPIRED_MESSAGE);
            }
            throw new ApiException(ErrorCode.TOKEN_INVALID);
        }
    }
}
