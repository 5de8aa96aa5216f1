package com.inkblog.backend.auth.refresh;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;

import com.inkblog.backend.auth.AbstractAuthIntegrationTest;
import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.domain.UserStatus;
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport.TokenResult;
import com.inkblog.backend.global.ErrorCode;
import com.inkblog.backend.infra.TestClockConfig;

@DisplayName("[Auth][Refresh] 비활성/만료/유저 상태 보안 시나리오 통합 테스트")
class AuthRefreshSecurityTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired JdbcTemplate jdbc;
    @Autowired AuthProperties authProps;

    @BeforeEach
    void setUp() {
        createDefaultUser();
    }

    @Test
    @DisplayName("refresh: logout으로 비활성화된 refresh → 401 REFRESH_INVALID")
    void refresh_after_logout_is_invalid() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        String raw = login.refreshToken();

        AuthHttpSupport.performLogout(mvc, raw).andReturn();

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, raw),
                ErrorCode.REFRESH_INVALID
        );
    }

    @Test
    @DisplayName("refresh: expires_at 지난 refresh → 401 REFRESH_INVALID (clock advance로 만료 만들기)")
    void refresh_expired_token_is_invalid() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(authProps.refresh().ttlSeconds() + 1));

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.REFRESH_INVALID
        );
    }

    @Test
    @DisplayName("refresh: 만료 1초 전까지는 사용 가능")
    void refresh_just_before_expiry_still_works() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(authProps.refresh().ttlSeconds() - 1));

        AuthFlowSupport.refreshOk(mvc, login.refreshToken());
    }

    @Test
    @DisplayName("refresh: 비활성 계정 → 403 ACCOUNT_DEACTIVATED")
    void refresh_for_deactivated_user_is_rejected() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        jdbc.update("update users set status = ? where email = ?", UserStatus.DEACTIVATED.name(), EMAIL);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.ACCOUNT_DEACTIVATED
        );
    }

    @Test
    @DisplayName("refresh: 로그인 후 유저 삭제(토큰 row도 CASCADE로 제거됨) → REFRESH_INVALID")
    void refresh_when_user_deleted_after_login() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        jdbc.update("delete from users where id = ?", login.userId());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, login.refreshToken()),
                ErrorCode.REFRESH_INVALID
        );
    }
}
