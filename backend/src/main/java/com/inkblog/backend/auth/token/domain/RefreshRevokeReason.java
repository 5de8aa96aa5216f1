package com.inkblog.backend.auth.token.domain;

/**
 * RefreshToken 비활성화(Revoke) 사유
 * 
 * RefreshToken은 서버가 세션처럼 통제하는 상태(State)
 * 
 * ROTATED: refresh 성공으로 제출된 토큰을 1회용 폐기함 (rotate=true일 때만)
 * LOGOUT: 사용자가 해당 기기에서 로그아웃
 * LOGOUT_ALL: "모든 기기에서 로그아웃"
 * PASSWORD_CHANGED: 비밀번호 변경으로 전체 세션 종료
 * QUOTA_EVICTED: 유저당 최대 세션 수 초과로 가장 오래된 세션부터 밀려남
 */
public enum RefreshRevokeReason { ROTATED, LOGOUT, LOGOUT_ALL, PASSWORD_CHANGED, QUOTA_EVICTED }
