package com.inkblog.backend.auth.refresh;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import com.inkblog.backend.auth.AbstractAuthIntegrationTest;
import com.inkblog.backend.auth.config.AuthProperties;
import com.inkblog.backend.auth.domain.User;
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport.TokenResult;
import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.domain.RefreshToken;
import com.inkblog.backend.global.ErrorCode;

@DisplayName("[Auth][Refresh] 유저당 active refresh 쿼터 통합 테스트")
class RefreshQuotaTest extends AbstractAuthIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired AuthProperties authProps;

    private User user;

    @BeforeEach
    void seedUser() {
        user = createDefaultUser();
    }

    @Test
    @DisplayName("쿼터+1번 로그인 → active는 정확히 쿼터 개수, 가장 오래된 세션만 QUOTA_EVICTED")
    void oldest_session_is_evicted_beyond_quota() throws Exception {
        int max = authProps.refresh().maxActivePerUser();

        List<TokenResult> sessions = new ArrayList<>();
        for (int i = 0; i < max + 1; i++) {
            sessions.add(AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD));
        }

        assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(user.getId())).isEqualTo(max);

        // 가장 오래된 세션: 비활성 + 사유 기록 (다음 발급 전까지는 레코드가 남아 있다)
        RefreshToken oldest = refreshRecordOf(sessions.get(0).refreshToken());
        assertThat(oldest.isActive()).isFalse();
        assertThat(oldest.getRevokeReason()).isEqualTo(RefreshRevokeReason.QUOTA_EVICTED);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRefresh(mvc, sessions.get(0).refreshToken()),
                ErrorCode.REFRESH_INVALID
        );

        // 나머지는 살아있다.
        AuthFlowSupport.refreshOk(mvc, sessions.get(1).refreshToken());
    }

    @Test
    @DisplayName("쿼터 이하 로그인은 아무것도 밀어내지 않는다")
    void logins_within_quota_keep_all_sessions() throws Exception {
        int max = authProps.refresh().maxActivePerUser();

        for (int i = 0; i < max; i++) {
            AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        }

        assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(user.getId())).isEqualTo(max);
        assertThat(refreshTokenRepository.findAll()).allMatch(RefreshToken::isActive);
    }

    /**
     * 쿼터 계산은 users row 잠금 안에서만 일어난다.
     * 잠금이 없으면 동시 로그인들이 같은 "max-1개 active"를 보고 전부 발급해서 쿼터를 넘긴다.
     */
    @Test
    @DisplayName("쿼터-1개 보유 상태에서 동시 로그인 → 전부 성공해도 active는 정확히 쿼터 개수")
    void concurrent_logins_never_exceed_quota() throws Exception {
        int max = authProps.refresh().maxActivePerUser();
        int threads = 4;

        for (int i = 0; i < max - 1; i++) {
            AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<MvcResult>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    start.await();
                    return AuthHttpSupport.performLogin(mvc, EMAIL, PASSWORD).andReturn();
                }));
            }

            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            for (Future<MvcResult> f : futures) {
                assertThat(f.get(30, TimeUnit.SECONDS).getResponse().getStatus()).isEqualTo(200);
            }

            assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(user.getId())).isEqualTo(max);
        } finally {
            pool.shutdownNow();
        }
    }
}
