package com.inkblog.backend.auth.domain;

/**
 * 사용자 역할. Access Token의 role 클레임으로 실린다.
 * - Spring Security 권한 문자열은 "ROLE_" + name()
 */
public enum UserRole { USER, AUTHOR, ADMIN }
