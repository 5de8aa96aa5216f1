package com.inkblog.backend.auth.identity.me.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.inkblog.backend.auth.identity.me.dto.MeResponse;
import com.inkblog.backend.auth.repo.UserRepository;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import lombok.RequiredArgsConstructor;

/**
 * 내 정보 조회
 *
 * 존재/활성/잠금/비밀번호 변경 여부는 필터(AccessTokenAuthenticator)에서 이미 확인했다.
 * 여기서 USER_NOT_FOUND / ACCOUNT_DEACTIVATED 가 나는 건 필터 통과 직후 상태가 바뀐 경우뿐이다.
 */
@Service
@RequiredArgsConstructor
public class MeService {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public MeResponse me(Long userId) {
        return userRepository.findById(userId)
                .map(user -> {
                    if (!user.isActive()) throw new ApiException(ErrorCode.ACCOUNT_DEACTIVATED);
                    return MeResponse.from(user);
                })
                .orElseThrow(() -> new ApiException(ErrorCode.USER_NOT_FOUND));
    }
}
