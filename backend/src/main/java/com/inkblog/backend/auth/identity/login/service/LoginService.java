package com.inkblog.backend.auth.identity.login.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.identity.support.EmailUtils;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.dto.TokenResponse;
import com.inkblog.backend.auth.token.service.TokenIssuer;
import com.inkblog.backend.auth.token.service.TokenIssuer.TokenPair;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 * 
 * 판정 순서:
 * 1) 이메일 없음                 -> INVALID_CREDENTIALS
 * 2) 잠금 중 (lockUntil > now)   -> ACCOUNT_LOCKED (+ Retry-After). 비밀번호가 맞아도 잠금이 우선
 * 3) 비활성 계정                 -> ACCOUNT_DEACTIVATED
 * 4) 비밀번호 불일치             -> 실패 카운트 +1 (임계치면 잠금) 후 INVALID_CREDENTIALS
 * 5) 성공                        -> 카운터/잠금 초기화 + lastLoginAt + 토큰 한 쌍 발급
 * 
 * 보안:
 * - "이메일 없음"과 "비밀번호 불일치"는 동일 에러로 처리해 계정 유무 추측을 어렵게 한다.
 *
 * 트랜잭션:
 * - noRollbackFor = ApiException: 4)에서 예외를 던져도 실패 카운터/잠금은 커밋되어야 한다.
 * - users row를 FOR UPDATE로 읽어서 동시 실패 요청끼리 카운터가 유실되지 않게 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserRepository userRepository; 
    private final PasswordEncoder passwordEncoder;
    private final TokenIssuer tokenIssuer;

    private final AuthProperties props;
    private final Clock clock;

    @Transactional(noRollbackFor = ApiException.class)
    public TokenResponse login(String rawEmail, String rawPassword, DeviceInfo device) {
        // 컨트롤러 @Valid가 있어도 서비스는 방어적으로 체크한다.
        if (isBlank(rawEmail) || isBlank(rawPassword)) {
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        String email = EmailUtils.normalize(rawEmail);

        User user = userRepository.findByEmailForUpdate(email)
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        if (user.isLocked(now)) {
            throw ApiException.accountLocked(user.secondsUntilUnlock(now));
        }

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DEACTIVATED);
        }

        if (!passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
            boolean lockedNow = user.registerLoginFailure(
                    now,
                    props.lockout().maxFailedAttempts(),
                    props.lockout().lockDurationSeconds()
            );
            if (lockedNow) {
                log.warn("로그인 실패 누적으로 계정 잠금: userId={}, until={}", user.getId(), user.getLockUntil());
            }
            throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
        }

        // 토큰 발급(벌크 연산) 전에 User 변경을 끝낸다. 이후 user는 준영속 상태가 된다.
        user.resetLoginFailures();
        user.setLastLoginAt(now);

        TokenPair pair = tokenIssuer.issueTokenPair(user, device);
        return TokenResponse.of(pair, user);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
