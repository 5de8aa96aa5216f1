package com.inkblog.backend.auth.identity.register.service;

import java.util.regex.Pattern;  

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.device.DeviceInfo;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.identity.support.EmailUtils;
import com.inkblog.backend.auth.identity.support.IdentityPatterns;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.auth.token.dto.TokenResponse;
import com.inkblog.backend.auth.token.service.TokenIssuer;
import com.inkblog.backend.auth.token.service.TokenIssuer.TokenPair;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 회원가입 유스케이스
 *
 * - 가입 즉시 ACTIVE / USER / emailVerified=true 로 생성하고 토큰 한 쌍을 발급한다.
 * - 이메일/닉네임 중복은 선검사 + 최종은 DB Unique 제약으로 막는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegisterService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenIssuer tokenIssuer;

    private static final Pattern PASSWORD_PATTERN = Pattern.compile(IdentityPatterns.PASSWORD_REGEX);
    private static final Pattern NICKNAME_PATTERN = Pattern.compile(IdentityPatterns.NICKNAME_REGEX);

    @Transactional
    public TokenResponse register(String rawEmail, String rawPassword, String nickname, DeviceInfo device) {
        String email = EmailUtils.normalize(rawEmail);

        if (rawPassword == null || !PASSWORD_PATTERN.matcher(rawPassword).matches()) {
            throw new ApiException(ErrorCode.WEAK_PASSWORD);
        }
        String nick = normalizeAndValidateNickname(nickname);

        if (userRepository.existsByEmail(email)) 
            throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
        
        if (userRepository.existsByNickname(nick))
            throw new ApiException(ErrorCode.NICKNAME_ALREADY_EXISTS);

        User user;
        try {
            // saveAndFlush: Unique 위반을 여기서 바로 터뜨려야 아래 catch에서 코드 매핑이 된다.
            user = userRepository.saveAndFlush(User.create(email, passwordEncoder.encode(rawPassword), nick));
        } catch (DataIntegrityViolationException e) {
            /**
             * 레이스로 중복 가입 시도된 경우 DB 무결성 제약으로 최종 차단
             * - 어떤 제약(uq_users_email, uq_users_nickname)에 걸렸는지 다시 조회해서 에러코드로 매핑한다.
             * - 정말 다른 무결성 문제면 그대로 던진다.
             */
            if (userRepository.existsByEmail(email)) {
                throw new ApiException(ErrorCode.EMAIL_ALREADY_EXISTS);
            }
            if (userRepository.existsByNickname(nick)) {
                throw new ApiException(ErrorCode.NICKNAME_ALREADY_EXISTS);
            }
            throw e;
        }

        log.info("회원가입 완료: userId={}", user.getId());

        TokenPair pair = tokenIssuer.issueTokenPair(user, device);
        return TokenResponse.of(pair, user);
    }

    private String normalizeAndValidateNickname(String nickname) {
        String nick = nickname == null ? "" : nickname.trim();
        if (!NICKNAME_PATTERN.matcher(nick).matches()) {
            throw new ApiException(ErrorCode.INVALID_NICKNAME);
        }
        return nick;
    }
}
