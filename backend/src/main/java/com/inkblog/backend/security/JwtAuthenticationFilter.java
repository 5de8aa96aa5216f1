package com.inkblog.backend.security;

import java.io.IOException;

import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import com.inkblog.backend.global.ApiException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bearer access token 인증 필터
 *
 * - Bearer 토큰이 없으면 그냥 통과시킨다. 보호 경로라면 뒤에서 RestAuthEntryPoint가 AUTH_REQUIRED로 막는다.
 * - 토큰이 있으면 AccessTokenAuthenticator로 끝까지 검증한다. (서명/만료 + 유저 존재/활성/잠금/비밀번호 변경)
 * - 검증 실패는 여기서 바로 응답을 확정한다.
 * - 공개 경로(skipPaths: 로그인/refresh/logout 등)는 만료된 Bearer 헤더가 붙어 와도 보지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessTokenAuthenticator authenticator;
    private final SecurityErrorWriter errorWriter;
    private final RequestMatcher skipPaths;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return skipPaths.matches(request);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String token = resolveBearerToken(request);
        if (token == null || SecurityContextHolder.getContext().getAuthentication() != null) {
            chain.doFilter(request, response);
            return;
        }

        try {
            AuthPrincipal principal = authenticator.authenticate(token);
            SecurityContextHolder.getContext().setAuthentication(toAuthentication(principal, request));
        } catch (ApiException ex) {
            log.debug("access token 거부: code={}, uri={}", ex.getCode(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            errorWriter.write(response, ex);
            return;
        }

        chain.doFilter(request, response);
    }

    private static UsernamePasswordAuthenticationToken toAuthentication(AuthPrincipal principal, HttpServletRequest request) {
        var authentication = new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        return authentication;
    }

    // "Bearer <token>" 이외의 형태(Basic, 빈 Bearer 등)는 토큰 없음으로 본다.
    private static String resolveBearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = header.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
