package com.inkblog.backend.auth.identity.me.dto;

import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.domain.UserRole;

// UserSummary + 계정 활성 여부
public record MeResponse(
        Long userId,
        String email,
        String nickname,
        UserRole role,
        boolean emailVerified,
        boolean active
) {

    public static MeResponse from(User user) {
        return new MeResponse(
                user.getId(),
                user.getEmail(),
                user.getNickname(),
                user.getRole(),
                user.isEmailVerified(),
                user.isActive());
    }
}
