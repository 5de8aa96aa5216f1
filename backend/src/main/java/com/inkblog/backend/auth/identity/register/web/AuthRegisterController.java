package com.inkblog.backend.auth.identity.register.web;

import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.device.DeviceInfoResolver;
import com.inkblog.backend.auth.identity.register.dto.RegisterRequest;
import com.inkblog.backend.auth.identity.register.service.RegisterService;
import com.inkblog.backend.auth.token.dto.TokenResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * POST: /auth/register
 * - 가입과 동시에 로그인 상태가 된다. 201 + 토큰 한 쌍 (Cache-Control: no-store)
 */
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthRegisterController {

    private final RegisterService registerService;
    private final DeviceInfoResolver deviceInfoResolver;

    @PostMapping("/register")
    public ResponseEntity<TokenResponse> register(@RequestBody @Valid RegisterRequest req, HttpServletRequest request) {
        TokenResponse body = registerService.register(
            req.email(), 
            req.password(), 
            req.nickname(),
            deviceInfoResolver.resolve(request)
        ); 
        return ResponseEntity.status(HttpStatus.CREATED)
                .cacheControl(CacheControl.noStore())
                .body(body);
    }
}
