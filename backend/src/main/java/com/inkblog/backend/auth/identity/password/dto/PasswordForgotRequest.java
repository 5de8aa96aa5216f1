package com.inkblog.backend.auth.identity.password.dto;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.inkblog.backend.global.jackson.TrimStringDeserializer;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record PasswordForgotRequest(

        @JsonDeserialize(using = TrimStringDeserializer.class)
        @NotBlank(message = "이메일은 필수입니다.")
        @Email(message = "이메일 형식이 올바르지 않습니다.")
        @Size(max = 255)
        String email
) {}
