package com.inkblog.backend.auth.identity.password.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.regex.Pattern;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.identity.support.IdentityPatterns;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.service.RevocationService;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 변경 유스케이스
 *
 * 성공 시:
 * - passwordHash 교체 + passwordChangedAt = now (+ 로그인 실패 카운터 초기화)
 * - 모든 refresh 레코드 PASSWORD_CHANGED 비활성화 -> 다른 기기는 refresh 불가
 * - 변경 이전에 발급된 access token은 AccessTokenAuthenticator에서 PASSWORD_CHANGED로 거부된다.
 *   (iat, passwordChangedAt 모두 초 단위 비교)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordChangeService {

    private static final Pattern PASSWORD_PATTERN = Pattern.compile(IdentityPatterns.PASSWORD_REGEX);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final RevocationService revocationService;
    private final Clock clock;

    @Transactional
    public void changePassword(Long userId, String currentPassword, String newPassword) {
        User user = userRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));

        if (currentPassword == null || !passwordEncoder.matches(currentPassword, user.getPasswordHash())) {
            throw new ApiException(ErrorCode.CURRENT_PASSWORD_MISMATCH);
        }
        if (newPassword == null || !PASSWORD_PATTERN.matcher(newPassword).matches()) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD);
        }

        user.changePassword(passwordEncoder.encode(newPassword), LocalDateTime.now(clock));
        userRepository.flush();

        int revoked = revocationService.logoutAll(userId, RefreshRevokeReason.PASSWORD_CHANGED);
        log.info("비밀번호 변경: userId={}, revokedSessions={}", userId, revoked);
    }
}
