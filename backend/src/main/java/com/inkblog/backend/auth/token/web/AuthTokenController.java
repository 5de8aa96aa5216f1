package com.inkblog.backend.auth.token.web;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.device.DeviceInfoResolver;
import com.inkblog.backend.auth.token.dto.RefreshRequest;
import com.inkblog.backend.auth.token.dto.TokenResponse;
import com.inkblog.backend.auth.token.service.RefreshTokenService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/refresh (Authorization 헤더 불필요, 바디의 refreshToken이 자격 증명)
 *
 * 응답의 refreshToken:
 * - rotate=true 이면 새로 발급된 값. 요청에 쓴 값은 이 시점부터 REFRESH_INVALID
 * - rotate=false 이면 요청 값 그대로
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;
    private final DeviceInfoResolver deviceInfoResolver;

    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest req, HttpServletRequest request) {
        TokenResponse body = refreshTokenService.refresh(req.refreshToken(), deviceInfoResolver.resolve(request));
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(body);
    }
}
