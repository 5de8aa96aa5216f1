package com.inkblog.backend.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * 보안 필터 체인 설정
 *
 * - 서버 세션 없음(STATELESS). 인증 상태는 매 요청의 Bearer access token 으로만 판단한다.
 * - 로그인/가입/refresh/logout/비밀번호 재설정은 토큰 없이 호출한다. logout 은 refresh token 자체가 자격 증명이다.
 *   이 경로들은 JwtAuthenticationFilter 도 건너뛴다. 만료된 access token 을 습관적으로 붙여 보내도 refresh/logout 이 막히지 않는다.
 * - 나머지(/auth/me, /auth/logout-all, /auth/password ...)는 인증 필요.
 * - actuator 는 health 만 익명 허용. 다른 actuator 경로는 노출하지 않는다.
 */
@Configuration
public class SecurityConfig {

    static final RequestMatcher PUBLIC_AUTH_POSTS = new OrRequestMatcher(
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/register"),
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/login"),
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/refresh"),
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/logout"),
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/password/forgot"),
            AntPathRequestMatcher.antMatcher(HttpMethod.POST, "/auth/password/reset")
    );

    @Bean
    RestAuthEntryPoint restAuthEntryPoint(SecurityErrorWriter securityErrorWriter) {
        return new RestAuthEntryPoint(securityErrorWriter);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter(AccessTokenAuthenticator authenticator,
                                                    SecurityErrorWriter securityErrorWriter) {
        return new JwtAuthenticationFilter(authenticator, securityErrorWriter, PUBLIC_AUTH_POSTS);
    }

    // 필터 빈이 서블릿 컨테이너에 한 번 더 등록되지 않게 한다. (보안 체인 안에서만 돈다)
    @Bean
    FilterRegistrationBean<JwtAuthenticationFilter> jwtAuthenticationFilterRegistration(JwtAuthenticationFilter jwtFilter) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(jwtFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http,
                                            RestAuthEntryPoint entryPoint,
                                            JwtAuthenticationFilter jwtFilter) throws Exception {
        return http
                .csrf(AbstractHttpConfigurer::disable)        // 쿠키 세션이 없으므로 CSRF 토큰 불필요
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)      // /auth/logout 은 우리 컨트롤러가 처리
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(eh -> eh.authenticationEntryPoint(entryPoint))
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()
                        .requestMatchers(HttpMethod.GET, "/actuator/health", "/actuator/health/**").permitAll()
                        .requestMatchers(PUBLIC_AUTH_POSTS).permitAll()
                        .anyRequest().authenticated()
                )
                .build();
    }
}
