package com.inkblog.backend.auth.identity.password.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.config.PasswordResetProperties;
import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.identity.password.domain.PasswordReset;
import com.inkblog.backend.auth.identity.password.event.PasswordResetIssuedEvent;
import com.inkblog.backend.auth.identity.password.repo.PasswordResetRepository;
import com.inkblog.backend.auth.identity.password.support.PasswordResetTokens;
import com.inkblog.backend.auth.identity.support.EmailUtils;
import com.inkblog.backend.auth.identity.support.IdentityPatterns;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.service.RevocationService;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 재설정(메일 링크) 유스케이스
 *
 * requestReset(email)
 * - 응답은 항상 같다. 없는 이메일, 비활성 계정, 요청 한도 초과 모두 조용히 끝난다. (계정 존재 여부 노출 금지)
 * - users row를 잠근 뒤: 오래된 row 정리 -> 시간당 한도 확인 -> 남아 있던 링크 폐기 -> 새 링크 저장
 * - 메일은 커밋 이후 PasswordResetMailEventListener가 보낸다.
 *
 * resetPassword(token, newPassword)
 * - 사용 가능한 링크가 아니면 RESET_TOKEN_INVALID (없음/만료/이미 사용 전부 같은 코드)
 * - 비활성 계정이면 ACCOUNT_DEACTIVATED. 링크는 소모되지 않는다.
 * - 성공 시 비밀번호 교체(+ 잠금 해제) -> 링크 1회 사용 처리 -> 모든 refresh PASSWORD_CHANGED 비활성화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    private static final Pattern PASSWORD_PATTERN = Pattern.compile(IdentityPatterns.PASSWORD_REGEX);
    private static final long RATE_WINDOW_SECONDS = 3600;

    private final UserRepository userRepository;
    private final PasswordResetRepository passwordResetRepository;
    private final PasswordResetTokens resetTokens;
    private final PasswordEncoder passwordEncoder;
    private final RevocationService revocationService;
    private final ApplicationEventPublisher eventPublisher;
    private final PasswordResetProperties props;
    private final Clock clock;

    @Transactional
    public void requestReset(String rawEmail, DeviceInfo requestedFrom) {
        String email = EmailUtils.normalize(rawEmail);
        Optional<User> found = userRepository.findByEmailForUpdate(email);
        if (found.isEmpty()) {
            log.debug("비밀번호 재설정 요청 무시: 가입되지 않은 이메일");
            return;
        }

        User user = found.get();
        if (!user.isActive()) {
            log.info("비밀번호 재설정 요청 무시: 비활성 계정 userId={}", user.getId());
            return;
        }

        Long userId = user.getId();
        String nickname = user.getNickname();
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime windowStart = now.minusSeconds(RATE_WINDOW_SECONDS);

        passwordResetRepository.deleteStaleByUserId(userId, now, windowStart);

        long recent = passwordResetRepository.countByUserIdAndCreatedAtAfter(userId, windowStart);
        if (recent >= props.maxRequestsPerHour()) {
            log.warn("비밀번호 재설정 요청 한도 초과: userId={}, recent={}", userId, recent);
            return;
        }

        passwordResetRepository.revokeOutstanding(userId, now);

        String raw = resetTokens.newRaw();
        LocalDateTime expiresAt = now.plusSeconds(props.ttlSeconds());
        passwordResetRepository.save(
                PasswordReset.issue(userId, PasswordResetTokens.hashOf(raw), requestedFrom, now, expiresAt));

        eventPublisher.publishEvent(new PasswordResetIssuedEvent(email, nickname, raw, expiresAt));
        log.info("비밀번호 재설정 링크 발급: userId={}, expiresAt={}", userId, expiresAt);
    }

    @Transactional
    public void resetPassword(String rawToken, String newPassword) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new ApiException(ErrorCode.RESET_TOKEN_INVALID);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        PasswordReset reset = passwordResetRepository.findUsable(PasswordResetTokens.hashOf(rawToken), now)
                .orElseThrow(() -> new ApiException(ErrorCode.RESET_TOKEN_INVALID));

        Long userId = reset.getUserId();
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.RESET_TOKEN_INVALID));

        if (!user.isActive()) {
            throw new ApiException(ErrorCode.ACCOUNT_DEACTIVATED);
        }
        if (newPassword == null || !PASSWORD_PATTERN.matcher(newPassword).matches()) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD);
        }

        // 변경분은 아래 CAS의 flushAutomatically로 같이 나간다. CAS에 지면 예외 -> 롤백
        user.changePassword(passwordEncoder.encode(newPassword), now);

        if (passwordResetRepository.markUsedIfUsable(reset.getId(), now) != 1) {
            throw new ApiException(ErrorCode.RESET_TOKEN_INVALID);
        }
        passwordResetRepository.revokeOutstanding(userId, now);

        int revoked = revocationService.logoutAll(userId, RefreshRevokeReason.PASSWORD_CHANGED);
        log.info("비밀번호 재설정 완료: userId={}, resetId={}, revokedSessions={}", userId, reset.getId(), revoked);
    }
}
