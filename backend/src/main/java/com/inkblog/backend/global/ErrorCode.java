package com.inkblog.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드(클라이언트 분기용) + HTTP 상태 + 기본 메시지의 단일 소스.
 *
 * 원칙:
 * - code = enum name() (변경 시 API 계약 깨짐)
 * - status/message는 정책에 따라 바뀔 수 있지만, code는 최대한 고정한다.
 */
public enum ErrorCode {

    // Register
    EMAIL_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "이미 가입된 이메일입니다."),
    NICKNAME_ALREADY_EXISTS(HttpStatus.CONFLICT,
            "이미 사용 중인 닉네임입니다."),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST,
            "비밀번호는 9~64자, 영문+숫자+특수문자를 포함하고 공백이 없어야 합니다."),
    INVALID_NICKNAME(HttpStatus.BAD_REQUEST,
            "닉네임은 2~20자, 한글/영문/숫자/_(언더스코어)만 허용하며 공백은 불가합니다."),

    // Login
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED,
            "이메일 또는 비밀번호가 올바르지 않습니다."),

    // Account state (로그인/refresh/보호 API 공통)
    ACCOUNT_DEACTIVATED(HttpStatus.FORBIDDEN,
            "비활성화된 계정입니다."),
    ACCOUNT_LOCKED(HttpStatus.LOCKED,
            "로그인 실패가 반복되어 계정이 일시적으로 잠겼습니다. 잠시 후 다시 시도해주세요."),

    // Password change
    CURRENT_PASSWORD_MISMATCH(HttpStatus.BAD_REQUEST,
            "현재 비밀번호가 올바르지 않습니다."),

    // Password reset
    RESET_TOKEN_INVALID(HttpStatus.BAD_REQUEST,
            "비밀번호 재설정 링크가 유효하지 않거나 만료되었습니다."), // 없음/만료/이미 사용 전부 같은 코드

    // Auth / Security
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED,
            "인증이 필요합니다."),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."),
    PASSWORD_CHANGED(HttpStatus.UNAUTHORIZED,
            "비밀번호가 변경되었습니다. 다시 로그인해주세요."),

    // Refresh token
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED,
            "리프레시 토큰이 유효하지 않습니다."), // 없음/만료/비활성/로테이션 패배 전부 같은 코드

    // User / Data consistency
    USER_NOT_FOUND(HttpStatus.UNAUTHORIZED,
            "엑세스 토큰이 유효하지 않습니다."), // 보안상 메시지 뭉개기 (계정 존재 여부 노출 금지)

    // Validation / Common
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST,
            "요청 값이 올바르지 않습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR,
            "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
