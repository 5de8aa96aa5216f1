package com.inkblog.backend.global;

import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 컨트롤러 경로의 예외 -> ApiError 변환
 *
 * 필터 단계(JWT 검증 실패 등)에서 난 예외는 여기까지 오지 않는다. 그쪽은 SecurityErrorWriter 담당.
 * HTTP 상태는 항상 ErrorCode에서 가져온다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // 의도된 비즈니스 실패. ACCOUNT_LOCKED면 Retry-After 헤더를 같이 싣는다.
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handleApiException(ApiException e) {
        return respond(e.getErrorCode(), ApiError.from(e), e.getRetryAfterSeconds());
    }

    /**
     * @Valid @RequestBody 검증 실패
     * - 어떤 필드가 틀렸는지만 details로 내려주고, 제약 메시지는 로그에만 남긴다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        List<FieldError> fieldErrors = e.getBindingResult().getFieldErrors();
        fieldErrors.forEach(fe -> log.warn("요청 검증 실패: field={}, message={}", fe.getField(), fe.getDefaultMessage()));

        List<String> fields = fieldErrors.stream()
                .map(FieldError::getField)
                .distinct()
                .toList();

        ApiError body = fields.isEmpty()
                ? ApiError.of(ErrorCode.VALIDATION_ERROR)
                : ApiError.of(ErrorCode.VALIDATION_ERROR, fields);
        return respond(ErrorCode.VALIDATION_ERROR, body, null);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException e) {
        e.getConstraintViolations()
                .forEach(v -> log.warn("요청 검증 실패: path={}, message={}", v.getPropertyPath(), v.getMessage()));

        return respond(ErrorCode.VALIDATION_ERROR, ApiError.of(ErrorCode.VALIDATION_ERROR), null);
    }

    // 바디 없음, JSON 문법 오류, 타입 불일치
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("요청 바디 파싱 실패: {}", e.getMostSpecificCause().getMessage());
        return respond(ErrorCode.VALIDATION_ERROR, ApiError.of(ErrorCode.VALIDATION_ERROR), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnhandled(Exception e) {
        log.error("처리되지 않은 예외", e);
        return respond(ErrorCode.INTERNAL_ERROR, ApiError.of(ErrorCode.INTERNAL_ERROR), null);
    }

    private static ResponseEntity<ApiError> respond(ErrorCode errorCode, ApiError body, Long retryAfterSeconds) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(errorCode.status());
        if (retryAfterSeconds != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }
        return builder.body(body);
    }
}
