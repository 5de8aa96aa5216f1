package com.inkblog.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * # [Application Domain Config]
 *
 * app:
 *   auth:
 *     password-reset:
 *       ttl-seconds: 3600              # 링크 유효 시간 (1시간)
 *       max-requests-per-hour: 3       # 유저당 시간당 발급 횟수
 *       link-base-url: http://localhost:5173/reset-password/
 *
 * 메일 본문 링크 = linkBaseUrl + 토큰 원문
 */
@Validated
@ConfigurationProperties(prefix = "app.auth.password-reset")
public record PasswordResetProperties(
        @Min(60) long ttlSeconds,
        @Min(1) int maxRequestsPerHour,
        @NotBlank String linkBaseUrl) {
}
