package com.inkblog.backend.auth.identity.password.web;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.identity.password.dto.PasswordChangeRequest;
import com.inkblog.backend.auth.identity.password.service.PasswordChangeService;
import com.inkblog.backend.global.ApiException;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.security.AuthPrincipal;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * PUT: /auth/password (Bearer 필요)
 * - 성공하면 204. 호출자의 refresh 포함 모든 세션이 끊기므로 다시 로그인해야 한다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth")
public class AuthPasswordController {

    private final PasswordChangeService passwordChangeService;

    @PutMapping("/password")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void changePassword(
            @AuthenticationPrincipal AuthPrincipal principal,
            @Valid @RequestBody PasswordChangeRequest req
    ) {
        if (principal == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }
        passwordChangeService.changePassword(principal.userId(), req.currentPassword(), req.newPassword());
    }
}
