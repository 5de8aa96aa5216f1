package com.inkblog.backend.auth.token.dto;

import java.util.Objects;

import com.inkblog.backend.auth.domain.User;

// 토큰 응답에 같이 내려가는 사용자 요약
public record UserSummary(
        Long userId,
        String email,
        String nickname,
        String role,
        boolean emailVerified
) {
    public static UserSummary from(User user) {
        Objects.requireNonNull(user, "user must not be null");
        return new UserSummary(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                user.getRole().name(),
                user.isEmailVerified()
        );
    }
}
