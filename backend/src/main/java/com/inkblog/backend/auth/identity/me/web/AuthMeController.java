package com.inkblog.backend.auth.identity.me.web;

import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.identity.me.dto.MeResponse;
import com.inkblog.backend.auth.identity.me.service.MeService;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

// GET: /auth/me (Bearer 필요)
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthMeController {

    private final MeService meService;

    @GetMapping("/me")
    public MeResponse me(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        return meService.me(principal.userId());
    }
}
