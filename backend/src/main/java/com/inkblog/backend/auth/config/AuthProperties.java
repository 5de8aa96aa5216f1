package com.inkblog.backend.auth.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;


/*
  @ConfigurationProperties(prefix = "app.auth"):
  application.yml + application-test.yml 설정 파일의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
  
  # [Application Domain Config]
  
  app:
    auth:
      jwt:
        issuer: inkblog
        audience: inkblog-users
        access-ttl-seconds: 900
        secret: ${APP_AUTH_JWT_SECRET}

      refresh:
        ttl-seconds: 2592000      # 30일
        max-active-per-user: 5    # 유저당 동시에 살아있는 refresh 개수
        rotate: true              # refresh 사용 시 1회용으로 교체할지
        sweep-interval: PT1H      # 만료 레코드 청소 주기

      lockout:
        max-failed-attempts: 5
        lock-duration-seconds: 7200  # 2시간
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(@Valid @NotNull Jwt jwt, 
                             @Valid @NotNull Refresh refresh,
                             @Valid @NotNull Lockout lockout) {
    
    /**
     * Access Token(JWT) 관련 설정
     * - issuer: 토큰 발급자 식별자 (iss)
     * - audience: 토큰 사용 대상 (aud). 다른 서비스용 토큰이 섞여 들어오는 것을 막는다.
     * - accessTtlSeconds: Access Token 수명
     * - secret: HS256 서명을 위한 비밀키 문자열
     */
    public record Jwt(
        @NotBlank String issuer,
        @NotBlank String audience,
        @Min(1) long accessTtlSeconds, 
        @NotBlank @Size(min = 32) String secret
    ) {}


    /**
     * Refresh Token(서버 저장 세션) 관련 설정
     * - ttlSeconds: 발급 시점부터의 수명
     * - maxActivePerUser: 유저당 active 상태로 유지되는 refresh 최대 개수 (초과분은 오래된 것부터 비활성화)
     * - rotate: true면 refresh 성공 시 제출된 토큰을 폐기하고 새 토큰을 내려준다.
     * - sweepInterval: 만료 레코드 삭제 스케줄 주기 (RefreshTokenSweeper)
     */
    public record Refresh(
            @Min(1) long ttlSeconds,

            @Min(1) int maxActivePerUser,

            boolean rotate,

            @NotNull Duration sweepInterval
    ) {}

    /**
     * 로그인 실패 잠금 정책
     * - maxFailedAttempts: 연속 실패 허용 횟수 (도달 시 잠금)
     * - lockDurationSeconds: 잠금 유지 시간
     */
    public record Lockout(
            @Min(1) int maxFailedAttempts,

            @Min(1) long lockDurationSeconds
    ) {}
}
