package com.inkblog.backend.auth.identity.login.web;

import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.device.DeviceInfoResolver;
import com.inkblog.backend.auth.identity.login.dto.LoginRequest;
import com.inkblog.backend.auth.identity.login.service.LoginService;
import com.inkblog.backend.auth.token.dto.TokenResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/login
 * - 200 {accessToken, refreshToken, expiresIn, user}
 * - 토큰이 담긴 응답이라 Cache-Control: no-store
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final DeviceInfoResolver deviceInfoResolver;

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest req, HttpServletRequest request) {
        TokenResponse body = loginService.login(req.email(), req.password(), deviceInfoResolver.resolve(request));
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(body);
    }
}
