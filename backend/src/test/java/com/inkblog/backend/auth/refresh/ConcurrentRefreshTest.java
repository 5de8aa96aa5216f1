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
import com.inkblog.backend.auth.support.AuthFlowSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport;
import com.inkblog.backend.auth.support.AuthHttpSupport.TokenResult;
import com.inkblog.backend.global.ErrorCode;

/**
 * 같은 refresh 토큰으로 동시에 refresh 요청이 들어오는 경우 (rotate=true)
 *
 * - 조건부 UPDATE(affected rows) + users row 잠금 때문에 승자는 정확히 1명이어야 한다.
 * - 나머지는 전부 REFRESH_INVALID
 * - active 레코드는 승자가 만든 1개만 남는다.
 */
@DisplayName("[Auth][Refresh] 동시 refresh 경합 통합 테스트")
class ConcurrentRefreshTest extends AbstractAuthIntegrationTest {

    private static final int THREADS = 4;

    @Autowired MockMvc mvc;

    @BeforeEach
    void seedUser() {
        createDefaultUser();
    }

    @Test
    @DisplayName("동일 refresh로 동시 요청 → 정확히 1건만 200, 나머지는 401 REFRESH_INVALID")
    void only_one_concurrent_refresh_wins() throws Exception {
        TokenResult login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);
        String raw = login.refreshToken();

        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch ready = new CountDownLatch(THREADS);
        CountDownLatch start = new CountDownLatch(1);

        try {
            List<Future<MvcResult>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    start.await();
                    return AuthHttpSupport.performRefresh(mvc, raw).andReturn();
                }));
            }

            assertThat(ready.await(5, TimeUnit.SECONDS)).isTrue();
            start.countDown();

            int ok = 0;
            int invalid = 0;
            for (Future<MvcResult> f : futures) {
                MvcResult res = f.get(30, TimeUnit.SECONDS);
                int status = res.getResponse().getStatus();
                if (status == 200) {
                    ok++;
                } else {
                    assertThat(status).isEqualTo(ErrorCode.REFRESH_INVALID.status().value());
                    AuthHttpSupport.assertErrorCode(res, ErrorCode.REFRESH_INVALID.name());
                    invalid++;
                }
            }

            assertThat(ok).isEqualTo(1);
            assertThat(invalid).isEqualTo(THREADS - 1);
            assertThat(refreshTokenRepository.countByUserIdAndActiveTrue(login.userId())).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
