package com.inkblog.backend.auth.token.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.domain.RefreshToken;
import com.inkblog.backend.auth.token.dto.TokenResponse;
import com.inkblog.backend.auth.token.service.RefreshTokenStore.IssuedRefresh;
import com.inkblog.backend.auth.token.service.TokenIssuer.TokenPair;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token으로 새 access token을 받는 유스케이스 (+ 옵션: 로테이션)
 * 
 * 흐름:
 * 1) findActive(raw)                    -> 없으면 REFRESH_INVALID
 * 2) 소유 유저 row 잠금 + 활성 여부      -> ACCOUNT_DEACTIVATED
 * 3) touch (조건부 UPDATE)              -> 0건이면 REFRESH_INVALID (동시 요청의 패자)
 * 4) access token 발급 (role/emailVerified는 DB에서 다시 읽은 값)
 * 5) rotate=true 면 기존 레코드 ROTATED 비활성화 후 새 refresh 발급
 *    rotate=false 면 같은 refresh raw를 그대로 돌려준다.
 * 
 * 실패 사유(없음/만료/비활성/로테이션 패배)는 전부 REFRESH_INVALID 하나로 뭉갠다.
 *
 * 동시성:
 * - 같은 refresh로 두 요청이 동시에 들어오면 둘 다 1)을 통과할 수 있다.
 *   2)의 유저 row 잠금에서 한 쪽이 기다리고, 승자가 커밋한 뒤 패자의 3)은 0건이 된다.
 */ 
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final RefreshTokenStore refreshTokenStore;
    private final UserRepository userRepository;
    private final JwtService jwtService;

    private final AuthProperties props;

    @Transactional
    public TokenResponse refresh(String refreshRaw, DeviceInfo device) {
        RefreshToken presented = refreshTokenStore.findActive(refreshRaw)
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        // 유저가 지워졌으면 refresh_tokens도 CASCADE로 사라지지만, 조회~잠금 사이 레이스는 여기서 막는다.
        User user = userRepository.findByIdForUpdate(presented.getUserId())
                .orElseThrow(() -> new ApiException(ErrorCode.REFRESH_INVALID));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DEACTIVATED);
        }

        if (!refreshTokenStore.touch(presented.getId())) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        String accessToken = jwtService.issueAccessToken(user.getId(), user.getRole(), user.isEmailVerified());
        String refreshOut = refreshRaw;

        if (props.refresh().rotate()) {
            if (!refreshTokenStore.deactivate(presented.getId(), RefreshRevokeReason.ROTATED)) {
                throw new ApiException(ErrorCode.REFRESH_INVALID);
            }
            IssuedRefresh replacement = refreshTokenStore.create(user.getId(), device);
            refreshOut = replacement.raw();
            log.debug("refresh 로테이션: userId={}, oldId={}, newId={}",
                    user.getId(), presented.getId(), replacement.record().getId());
        }

        TokenPair pair = new TokenPair(accessToken, refreshOut, jwtService.accessTtlSeconds());
        return TokenResponse.of(pair, user);
    }
}
