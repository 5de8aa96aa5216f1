package com.inkblog.backend.auth.refresh;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.inkblog.backend.auth.AbstractAuthIntegrationTest;
import com.inkblog.backend.auth.domain.UserRole;
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport.TokenResult;
import com.inkblog.backend.auth.token.domain.RefreshToken;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.infra.TestClockConfig;
import com.inkblog.backend.security.JwtService;


@DisplayName("[Auth][Refresh] 리프레시 토큰 로테이션 통합 테스트")
class AuthRefreshRotationTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;
    @Autowired JwtService jwtService;

    @BeforeEach
    void seedUser() {
        createDefaultUser();
    }

    @Test
    @DisplayName("리프레시: 정상 로테이션 → 새 refresh 발급 + 새 레코드 active")
    void refresh_rotates_and_new_record_is_active() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        String oldRaw = login.refreshToken();

        TokenResult refreshed = AuthFlowSupport.refreshOk(mvc, oldRaw);
        String newRaw = refreshed.refreshToken();

        assertThat(newRaw).isNotEqualTo(oldRaw);
        assertThat(refreshed.userId()).isEqualTo(login.userId());

        RefreshToken newRow = refreshRecordOf(newRaw);
        assertThat(newRow.isActive()).isTrue();

        // 옛 레코드는 더 이상 active 조회에 잡히지 않는다. (비활성 후 발급 직전 정리로 삭제됨)
        assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(login.userId())).isEqualTo(1);
    }

    @Test
    @DisplayName("리프레시: 로테이션 후 구 refresh 재사용 → 401 REFRESH_INVALID")
    void refresh_reuse_old_token_is_rejected() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        String oldRaw = login.refreshToken();

        AuthFlowSupport.refreshOk(mvc, oldRaw);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, oldRaw),
                ErrorCode.REFRESH_INVALID
        );
    }

    @Test
    @DisplayName("리프레시: 연속 로테이션 체인 → 매번 직전 토큰만 유효")
    void refresh_chain_keeps_single_active_record() throws Exception {
        TokenResult current = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        for (int i = 0; i < 3; i++) {
            current = AuthFlowSupport.refreshOk(mvc, current.refreshToken());
        }

        assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(current.userId())).isEqualTo(1);
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(current.accessToken()))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("리프레시: role 변경은 refresh 시점에 DB에서 다시 읽어 반영된다")
    void refresh_reads_role_fresh_from_storage() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        // 기존 access token에는 USER가 박혀 있다.
        assertThat(jwtService.verifyAccessToken(login.accessToken()).role()).isEqualTo(UserRole.USER);

        jdbc.update("update users set role = ? where email = ?", UserRole.AUTHOR.name(), EMAIL);

        MvcResult res = AuthHttpSupport.performRefresh(mvc, login.refreshToken())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.role").value(UserRole.AUTHOR.name()))
                .andReturn();

        TokenResult refreshed = AuthHttpSupport.readTokenResult(res);
        assertThat(jwtService.verifyAccessToken(refreshed.accessToken()).role()).isEqualTo(UserRole.AUTHOR);
    }

    @Test
    @DisplayName("리프레시: 만료된 access token을 Authorization에 붙여 보내도 200 + 로테이션")
    void refresh_ignores_expired_bearer_header() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        TestClockConfig.TEST_CLOCK.advance(Duration.ofMinutes(20));

        // access는 이미 만료: 보호 자원에서는 401
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.TOKEN_INVALID
        );

        MvcResult res = AuthHttpSupport.performRefresh(
                        mvc, login.refreshToken(), AuthHttpSupport.bearer(login.accessToken()))
                .andExpect(status().isOk())
                .andReturn();

        TokenResult refreshed = AuthHttpSupport.readTokenResult(res);
        assertThat(refreshed.refreshToken()).isNotEqualTo(login.refreshToken());
        assertThat(refreshRecordOf(login.refreshToken()).isActive()).isFalse();
        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(refreshed.accessToken()))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("리프레시: refreshToken 필드 없음 → 400 VALIDATION_ERROR")
    void refresh_without_token_is_validation_error() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, null),
                ErrorCode.VALIDATION_ERROR
        );
    }

    @Test
    @DisplayName("리프레시: 미발급 refresh 토큰 → 401 REFRESH_INVALID")
    void refresh_unknown_token_returns_refresh_invalid() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, "definitely-not-issued-by-server"),
                ErrorCode.REFRESH_INVALID
        );
    }
}
