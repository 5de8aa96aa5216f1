package com.inkblog.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.inkblog.backend.auth.device.DeviceClassifier;
import com.inkblog.backend.auth.device.UserAgentDeviceClassifier;

/**
 * 인증 모듈 공용 빈
 *
 * - AuthProperties(app.auth.*), PasswordResetProperties, AppMailProperties(app.mail.*) 바인딩 + @Validated 검증 활성화
 * - Clock: 서버 기준 시각은 KST. 테스트는 TestClockConfig의 MutableClock이 대신 들어간다.
 * - SecureRandom: refresh token / 비밀번호 재설정 토큰 원문 생성용
 * - PasswordEncoder: BCrypt
 * - DeviceClassifier: 다른 구현을 빈으로 올리면 기본 키워드 분류기는 빠진다.
 */
@Configuration
@EnableConfigurationProperties({AuthProperties.class, PasswordResetProperties.class, AppMailProperties.class})
public class AuthModuleConfig {

    public static final ZoneId SERVER_ZONE = ZoneId.of("Asia/Seoul");

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.system(SERVER_ZONE);
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    @ConditionalOnMissingBean(DeviceClassifier.class)
    public DeviceClassifier deviceClassifier() {
        return new UserAgentDeviceClassifier();
    }
}
