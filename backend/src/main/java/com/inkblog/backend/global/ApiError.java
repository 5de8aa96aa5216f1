package com.inkblog.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 모든 실패 응답의 JSON 본문
 *
 * ControllerAdvice, 보안 필터, EntryPoint 어디서 실패하든 이 모양 하나로 내려간다.
 *
 * - code: ErrorCode.name(). 클라이언트는 이 값으로만 분기한다.
 * - message: 사람이 읽는 문구 (바뀔 수 있음)
 * - retryAfterSeconds: ACCOUNT_LOCKED 일 때 잠금 해제까지 남은 초 (Retry-After 헤더와 같은 값)
 * - details: VALIDATION_ERROR 일 때 잘못된 필드명 목록
 *
 * null 필드는 직렬화하지 않는다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code,
        String message,
        Long retryAfterSeconds,
        Object details
) {

    public static ApiError of(ErrorCode errorCode) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, null);
    }

    public static ApiError of(ErrorCode errorCode, Object details) {
        return new ApiError(errorCode.name(), errorCode.defaultMessage(), null, details);
    }

    public static ApiError from(ApiException e) {
        return new ApiError(e.getCode(), e.getMessage(), e.getRetryAfterSeconds(), e.getDetails());
    }
}
