package com.inkblog.backend.global;

import java.util.Objects;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 서비스/보안 계층이 던지는 단일 비즈니스 예외
 *
 * - 어떤 실패인지는 ErrorCode 하나로 결정된다. (HTTP 상태, code 문자열 모두 ErrorCode에서 파생)
 * - 응답 직렬화는 GlobalExceptionHandler(컨트롤러 경로)와 SecurityErrorWriter(필터 경로)가 맡는다.
 *
 *   throw new ApiException(ErrorCode.REFRESH_INVALID);
 *   throw ApiException.accountLocked(user.secondsUntilUnlock(now));
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Long retryAfterSeconds;
    private final Object details;

    public ApiException(ErrorCode errorCode) {
        this(errorCode, null, null, null);
    }

    // 같은 code로 문구만 바꿔야 할 때 (만료된 access token 안내 등)
    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null, null);
    }

    private ApiException(ErrorCode errorCode, String messageOverride, Long retryAfterSeconds, Object details) {
        super(messageOverride == null || messageOverride.isBlank()
                ? Objects.requireNonNull(errorCode, "errorCode must not be null").defaultMessage()
                : messageOverride);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }

    // 로그인 실패 누적으로 잠긴 계정. Retry-After 헤더 값도 여기서 나온다.
    public static ApiException accountLocked(long secondsUntilUnlock) {
        return new ApiException(ErrorCode.ACCOUNT_LOCKED, null, Math.max(1L, secondsUntilUnlock), null);
    }

    public HttpStatus getStatus() {
        return errorCode.status();
    }

    public String getCode() {
        return errorCode.name();
    }
}
