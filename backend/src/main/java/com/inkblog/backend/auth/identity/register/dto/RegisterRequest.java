package com.inkblog.backend.auth.identity.register.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.inkblog.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 회원가입 요청
 * - 1차 입력 검증(@Valid)만 담당하고, 비밀번호 강도/닉네임 규칙은 서비스에서 본다.
 */
public record RegisterRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 255, message = "이메일이 너무 깁니다.")
        String email,

        @NotBlank(message = "비밀번호는 필수입니다.")
        @Size(max = 72, message = "비밀번호가 너무 깁니다.")
        String password,
        
        @NotBlank(message = "닉네임은 필수입니다.")
        @Size(max = 50, message = "닉네임이 너무 깁니다.")
        String nickname
        ) {
}
