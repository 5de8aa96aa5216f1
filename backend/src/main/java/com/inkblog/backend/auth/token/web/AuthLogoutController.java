package com.inkblog.backend.auth.token.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.dto.LogoutRequest;
import com.inkblog.backend.auth.token.service.RevocationService;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;


/**
 * POST: /auth/logout      (인증 불필요)
 * POST: /auth/logout-all  (Bearer 필요)
 * 
 * logout은 멱등:
 * - 바디 없음 / 모르는 토큰 / 이미 비활성 => 전부 204
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthLogoutController {
    
    private final RevocationService revocationService;

    @PostMapping("/logout")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logout(@RequestBody(required = false) LogoutRequest req) {
        revocationService.logout(req == null ? null : req.refreshToken());
    }

    @PostMapping("/logout-all")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void logoutAll(@AuthenticationPrincipal AuthPrincipal principal) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        revocationService.logoutAll(principal.userId(), RefreshRevokeReason.LOGOUT_ALL);
    }

}
