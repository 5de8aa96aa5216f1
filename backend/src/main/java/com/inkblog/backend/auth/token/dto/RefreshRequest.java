package com.inkblog.backend.auth.token.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RefreshRequest(
        @NotBlank(message = "refreshToken은 필수입니다.")
        @Size(max = 512)
        String refreshToken
) {}
