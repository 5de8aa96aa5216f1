package com.inkblog.client.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inkblog.client.auth.AccessTokenRefresher.TokenResult;

@DisplayName("[Client] ProactiveRefreshScheduler")
class ProactiveRefreshSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final TokenExpiryReader READER = new TokenExpiryReader(new ObjectMapper());

    @Test
    @DisplayName("만료 임박 토큰은 주기 점검에서 미리 refresh 된다")
    void refreshes_expiring_token_in_background() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        String newAccess = JwtFixtures.tokenExpiringAt(NOW.plus(Duration.ofMinutes(30)));
        AccessTokenRefresher refresher = rt -> {
            calls.incrementAndGet();
            return new TokenResult(newAccess, "refresh-2", 900);
        };
        InMemoryCredentialStore store = new InMemoryCredentialStore(
                new Credentials(JwtFixtures.tokenExpiringAt(NOW.plusSeconds(30)), "refresh-1"));
        RefreshCoordinator coordinator = new RefreshCoordinator(refresher, store, READER, Runnable::run, CLOCK);

        try (ProactiveRefreshScheduler scheduler = new ProactiveRefreshScheduler(coordinator, Duration.ofMillis(20))) {
            scheduler.start();
            awaitAccessToken(store, newAccess);
            TimeUnit.MILLISECONDS.sleep(100);
        }

        // 새 토큰은 충분히 남아 있으므로 이후 점검은 추가 호출을 만들지 않는다.
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("로그아웃 상태에서는 점검해도 refresh를 시도하지 않는다")
    void skips_when_logged_out() {
        AtomicInteger calls = new AtomicInteger();
        AccessTokenRefresher refresher = rt -> {
            calls.incrementAndGet();
            return new TokenResult("a", "r", 900);
        };
        RefreshCoordinator coordinator = new RefreshCoordinator(
                refresher, new InMemoryCredentialStore(), READER, Runnable::run, CLOCK);

        try (ProactiveRefreshScheduler scheduler = new ProactiveRefreshScheduler(coordinator)) {
            scheduler.checkNow();
        }

        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("refresh 실패는 예외로 새어 나오지 않고, 자격 증명은 비워진다")
    void failure_is_contained() {
        AccessTokenRefresher refresher = rt -> {
            throw new RefreshFailedException("refresh 거부", "REFRESH_INVALID", 401);
        };
        InMemoryCredentialStore store = new InMemoryCredentialStore(
                new Credentials(JwtFixtures.tokenExpiringAt(NOW.minusSeconds(1)), "refresh-1"));
        RefreshCoordinator coordinator = new RefreshCoordinator(refresher, store, READER, Runnable::run, CLOCK);

        try (ProactiveRefreshScheduler scheduler = new ProactiveRefreshScheduler(coordinator)) {
            scheduler.checkNow();
        }

        assertThat(store.current()).isEmpty();
    }

    @Test
    @DisplayName("start는 한 번만, period는 양수만 허용")
    void guards() {
        RefreshCoordinator coordinator = new RefreshCoordinator(
                rt -> new TokenResult("a", "r", 1), new InMemoryCredentialStore(), READER, Runnable::run, CLOCK);

        assertThatThrownBy(() -> new ProactiveRefreshScheduler(coordinator, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);

        try (ProactiveRefreshScheduler scheduler = new ProactiveRefreshScheduler(coordinator, Duration.ofMinutes(1))) {
            scheduler.start();
            assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
        }
    }

    private static void awaitAccessToken(CredentialStore store, String expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            if (store.current().map(Credentials::accessToken).filter(expected::equals).isPresent()) {
                return;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
        throw new AssertionError("background refresh did not happen in time");
    }
}
