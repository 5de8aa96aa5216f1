package com.inkblog.backend.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkblog.backend.global.ApiError;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 필터 체인에서 끝나는 요청의 에러 응답 작성기
 *
 * JwtAuthenticationFilter / RestAuthEntryPoint에서 막힌 요청은 컨트롤러에 도달하지 않아
 * GlobalExceptionHandler를 거치지 않는다. 여기서 같은 ApiError 모양으로 직접 쓴다.
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorWriter {

    private final ObjectMapper objectMapper;

    // EntryPoint: Authorization 헤더 자체가 없음
    public void write(HttpServletResponse response, ErrorCode errorCode) throws IOException {
        writeBody(response, errorCode, null, ApiError.of(errorCode));
    }

    // Filter: access token 검증 실패 (ACCOUNT_LOCKED면 Retry-After 포함)
    public void write(HttpServletResponse response, ApiException e) throws IOException {
        writeBody(response, e.getErrorCode(), e.getRetryAfterSeconds(), ApiError.from(e));
    }

    private void writeBody(HttpServletResponse response, ErrorCode errorCode, Long retryAfterSeconds, ApiError body)
            throws IOException {
        if (response.isCommitted()) {
            return;
        }

        // 인증 실패 응답은 중간 프록시에 캐시되지 않게 한다.
        response.setHeader(HttpHeaders.CACHE_CONTROL, "no-store");
        response.setHeader(HttpHeaders.PRAGMA, "no-cache");
        if (retryAfterSeconds != null) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        }

        response.setStatus(errorCode.status().value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        objectMapper.writeValue(response.getWriter(), body);
    }
}
