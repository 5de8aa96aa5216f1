package com.inkblog.backend.auth.token.dto;

// refreshToken이 없거나 비어 있어도 로그아웃은 204로 끝난다.
public record LogoutRequest(String refreshToken) {}
