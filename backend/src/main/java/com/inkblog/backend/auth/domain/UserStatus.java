package com.inkblog.backend.auth.domain;

/**
 * 계정 상태
 * 
 * ACTIVE: 로그인/토큰 사용 가능
 * DEACTIVATED: 운영자/본인에 의해 비활성화됨. 로그인, refresh, 보호 API 모두 ACCOUNT_DEACTIVATED
 */
public enum UserStatus { ACTIVE, DEACTIVATED }
