package com.inkblog.client.auth;

/**
 * refresh 실패 (클라이언트 측)
 *
 * - code: 서버가 내려준 ApiError.code (REFRESH_INVALID, ACCOUNT_DEACTIVATED ...). 네트워크 오류 등 서버 응답이 없으면 null
 * - status: HTTP 상태코드. 서버 응답이 없으면 0
 *
 * 같은 refresh를 기다리던 호출자들은 모두 동일한 인스턴스를 받는다.
 */
public class RefreshFailedException extends RuntimeException {

    public static final String NO_CREDENTIALS = "NO_CREDENTIALS";

    private final String code;
    private final int status;

    public RefreshFailedException(String message, String code, int status) {
        this(message, code, status, null);
    }

    public RefreshFailedException(String message, String code, int status, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.status = status;
    }

    // 저장된 refresh token이 없어서 시도조차 못 한 경우
    public static RefreshFailedException noCredentials() {
        return new RefreshFailedException("저장된 자격 증명이 없습니다. 다시 로그인해야 합니다.", NO_CREDENTIALS, 0);
    }

    public String getCode() {
        return code;
    }

    public int getStatus() {
        return status;
    }
}
