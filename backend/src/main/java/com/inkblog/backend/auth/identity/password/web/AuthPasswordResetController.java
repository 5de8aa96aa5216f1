package com.inkblog.backend.auth.identity.password.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.inkblog.backend.auth.device.DeviceInfoResolver;
import com.inkblog.backend.auth.identity.password.dto.PasswordForgotRequest;
import com.inkblog.backend.auth.identity.password.dto.PasswordResetConfirmRequest;
import com.inkblog.backend.auth.identity.password.service.PasswordResetService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 비밀번호 재설정 (공개 API, Bearer 불필요)
 *
 * POST: /auth/password/forgot
 * - 항상 202. 메일이 실제로 나갔는지는 응답으로 알 수 없다.
 *
 * POST: /auth/password/reset
 * - 204. 모든 세션이 끊기므로 새 비밀번호로 다시 로그인해야 한다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/auth/password")
public class AuthPasswordResetController {

    private final PasswordResetService passwordResetService;
    private final DeviceInfoResolver deviceInfoResolver;

    @PostMapping("/forgot")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void forgot(@Valid @RequestBody PasswordForgotRequest req, HttpServletRequest request) {
        passwordResetService.requestReset(req.email(), deviceInfoResolver.resolve(request));
    }

    @PostMapping("/reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void reset(@Valid @RequestBody PasswordResetConfirmRequest req) {
        passwordResetService.resetPassword(req.token(), req.newPassword());
    }
}
