package com.inkblog.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.inkblog.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

// 보호 경로에 Bearer 토큰 없이 들어온 요청 -> 401 AUTH_REQUIRED
@Slf4j
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        log.debug("인증 없는 보호 경로 접근: method={}, uri={}", request.getMethod(), request.getRequestURI());
        errorWriter.write(response, ErrorCode.AUTH_REQUIRED);
    }
}
