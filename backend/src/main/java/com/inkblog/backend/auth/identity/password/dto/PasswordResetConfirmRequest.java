package com.inkblog.backend.auth.identity.password.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.inkblog.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

// 메일 링크에서 꺼낸 토큰 + 새 비밀번호. 토큰 유효성/비밀번호 규칙은 PasswordResetService 몫
public record PasswordResetConfirmRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "재설정 토큰은 필수입니다.")
        @Size(max = 128)
        String token,

        @NotBlank(message = "새 비밀번호는 필수입니다.")
        @Size(max = 72, message = "비밀번호가 너무 깁니다.")
        String newPassword
) {}
