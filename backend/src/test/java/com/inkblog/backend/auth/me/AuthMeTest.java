package com.inkblog.backend.auth.me;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.inkblog.backend.auth.AbstractAuthIntegrationTest;
import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.domain.UserRole;
import com.inkblog.backend.auth.domain.UserStatus;
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport.TokenResult;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.infra.TestClockConfig;

/**
 * /auth/me 통합 테스트 (SecurityFilterChain + Controller + Service까지 포함)
 *
 * 실제 흐름:
 *
 * [JwtAuthenticationFilter]
 * - Authorization 헤더 없거나 / "Bearer "로 시작 안 하면: token=null → 그냥 통과
 *   → 이후 SecurityConfig(anyRequest().authenticated())에 걸려 EntryPoint로 401(AUTH_REQUIRED)
 *
 * - Authorization: Bearer <token> 이면 AccessTokenAuthenticator가 순서대로 검사:
 *   TOKEN_INVALID → USER_NOT_FOUND → ACCOUNT_DEACTIVATED → ACCOUNT_LOCKED → PASSWORD_CHANGED
 *   실패하면 Filter에서 즉시 ApiError 응답
 *
 * [AuthMeController] -> [MeService]
 * - 정상이면 MeResponse 반환
 */
@DisplayName("[Auth][Me] 내 정보 조회(/auth/me) 통합 테스트")
class AuthMeTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;
    @Autowired AuthProperties authProps;

    @BeforeEach
    void seedUser() {
        createDefaultUser();
    }

    // =============================================================
    // 1) 인증 자체가 성립하지 않는 케이스 (EntryPoint -> AUTH_REQUIRED)
    // =============================================================
    @Test
    @DisplayName("me: Authorization 없음 → 401 AUTH_REQUIRED (EntryPoint)")
    void me_requires_auth_when_no_authorization_header() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, null);
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: Bearer가 아닌 Authorization → 401 AUTH_REQUIRED (EntryPoint)")
    void me_requires_auth_when_non_bearer_header() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, "Basic abcdefg");
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
    }

    @Test
    @DisplayName("me: Authorization='Bearer ' (토큰 공백) → 401 AUTH_REQUIRED (EntryPoint)")
    void me_requires_auth_when_bearer_token_blank() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, "Bearer ");
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.AUTH_REQUIRED);
    }


    // ============================================================
    // 2) 토큰은 있는데 못 쓰는 케이스 (Filter)
    // ============================================================
    
    @Test
    @DisplayName("me: 형식/서명 검증 실패 JWT → 401 TOKEN_INVALID")
    void me_rejects_invalid_jwt() throws Exception {
        ResultActions actions = AuthHttpSupport.performMe(mvc, "Bearer not-a-jwt");
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("me: refresh 토큰 문자열을 access처럼 사용 → 401 TOKEN_INVALID")
    void me_rejects_refresh_token_string_used_as_access_token() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.refreshToken()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("me: 만료된 access → 401 TOKEN_INVALID (코드는 같고 메시지만 만료 안내)")
    void me_rejects_expired_access_token_with_expired_message() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(authProps.jwt().accessTtlSeconds() + 1));

        MvcResult res = AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.TOKEN_INVALID);

        assertThat(AuthHttpSupport.readJson(res).path("message").asText()).contains("만료");
    }
    
    @Test
    @DisplayName("me: 토큰은 유효하지만 DB에 유저 없음 → 401 USER_NOT_FOUND (메시지는 TOKEN_INVALID와 동일)")
    void me_returns_user_not_found_when_user_deleted_after_login() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        // refresh_tokens는 FK CASCADE로 같이 지워진다.
        jdbc.update("delete from users where email = ?", EMAIL);

        MvcResult res = AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.USER_NOT_FOUND);

        assertThat(AuthHttpSupport.readJson(res).path("message").asText())
                .isEqualTo(ErrorCode.TOKEN_INVALID.defaultMessage());
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 비활성 계정 → 403 ACCOUNT_DEACTIVATED")
    void me_blocks_when_user_not_active() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        jdbc.update("update users set status = ? where email = ?", UserStatus.DEACTIVATED.name(), EMAIL);

        ResultActions actions = AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()));
        AuthHttpSupport.expectErrorWithCode(actions, ErrorCode.ACCOUNT_DEACTIVATED);
    }

    @Test
    @DisplayName("me: 토큰은 유효하지만 잠금 중인 계정 → 423 ACCOUNT_LOCKED + Retry-After")
    void me_blocks_when_user_locked() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        LocalDateTime lockUntil = LocalDateTime.now(TestClockConfig.TEST_CLOCK).plusMinutes(10);
        jdbc.update("update users set lock_until = ? where email = ?", Timestamp.valueOf(lockUntil), EMAIL);

        MvcResult res = AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.ACCOUNT_LOCKED);

        assertThat(res.getResponse().getHeader(HttpHeaders.RETRY_AFTER)).isEqualTo("600");
    }

    // ==========================================================
    // 3) 성공 케이스
    // ==========================================================

    @Test
    @DisplayName("me: 유효한 access 토큰 + ACTIVE 사용자 → 200 + 사용자 정보 반환")
    void me_returns_user_info_when_access_token_valid() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.userId").value(login.userId()))
                .andExpect(jsonPath("$.email").value(EMAIL))
                .andExpect(jsonPath("$.nickname").value(NICKNAME))
                .andExpect(jsonPath("$.role").value(UserRole.USER.name()))
                .andExpect(jsonPath("$.emailVerified").value(true))
                .andExpect(jsonPath("$.active").value(true));
    }
}
