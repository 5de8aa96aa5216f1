package com.inkblog.backend.auth.token;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;

import com.inkblog.backend.auth.AbstractAuthIntegrationTest;
import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.token.service.RefreshTokenSweeper;
import com.inkblog.backend.infra.TestClockConfig;

/**
 * 만료 refresh 레코드 스윕
 * - 스케줄 주기(PT24H)를 기다리지 않고 빈 메서드를 직접 호출한다.
 */
@DisplayName("[Auth][Refresh] 만료 레코드 스윕")
class RefreshTokenSweeperTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired RefreshTokenSweeper sweeper;
    @Autowired AuthProperties props;

    @Test
    @DisplayName("TTL이 지난 레코드만 삭제되고, 아직 유효한 레코드는 남는다")
    void sweep_deletes_only_expired_records() throws Exception {
        createDefaultUser();
        AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(props.refresh().ttlSeconds() / 2));
        AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        assertThat(refreshTokenRepository.count()).isEqualTo(2);

        // 첫 번째 레코드만 만료되는 시점
        TestClockConfig.TEST_CLOCK.advance(Duration.ofSeconds(props.refresh().ttlSeconds() / 2 + 1));
        sweeper.sweepExpired();

        assertThat(refreshTokenRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("만료된 레코드가 없으면 아무것도 지우지 않는다")
    void sweep_is_noop_without_expired_records() throws Exception {
        createDefaultUser();
        AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        sweeper.sweepExpired();

        assertThat(refreshTokenRepository.count()).isEqualTo(1);
    }
}
