package com.inkblog.backend.security;

import java.util.List;
import java.util.Objects;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import com.inkblog.backend.auth.domain.UserRole;

/**
 * 검증을 통과한 access token의 주인 (@AuthenticationPrincipal 로 받는다)
 *
 * role은 DB 현재 값이 아니라 토큰 발급 시점 값이다. 역할이 바뀌면 다음 refresh부터 반영된다.
 */
public record AuthPrincipal(Long userId, UserRole role) {

    private static final String ROLE_PREFIX = "ROLE_";

    public AuthPrincipal {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(role, "role must not be null");
    }

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(ROLE_PREFIX + role.name()));
    }
}
