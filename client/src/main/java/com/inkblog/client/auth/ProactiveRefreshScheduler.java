package com.inkblog.client.auth;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * 주기적으로 access token 만료를 점검해서 미리 refresh 한다.
 *
 * - 실제 refresh는 RefreshCoordinator 경로를 그대로 탄다. (요청 중 refresh와 겹쳐도 호출은 1번)
 * - 로그아웃 상태(자격 증명 없음)면 아무것도 하지 않는다.
 * - 실패는 로그만 남긴다. 자격 증명 삭제는 RefreshCoordinator가 이미 처리한다.
 */
@Slf4j
public class ProactiveRefreshScheduler implements AutoCloseable {

    public static final Duration DEFAULT_PERIOD = Duration.ofMinutes(5);

    private final RefreshCoordinator coordinator;
    private final Duration period;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> task;

    public ProactiveRefreshScheduler(RefreshCoordinator coordinator) {
        this(coordinator, DEFAULT_PERIOD);
    }

    public ProactiveRefreshScheduler(RefreshCoordinator coordinator, Duration period) {
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.period = Objects.requireNonNull(period, "period");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "inkblog-token-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (task != null) {
            throw new IllegalStateException("already started");
        }
        long millis = period.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::checkNow, millis, millis, TimeUnit.MILLISECONDS);
    }

    // 스케줄 스레드에서 호출된다. 예외가 새어 나가면 이후 실행이 멈추므로 여기서 끊는다.
    void checkNow() {
        try {
            if (!coordinator.hasCredentials()) {
                return;
            }
            coordinator.ensureValidToken().whenComplete((token, ex) -> {
                if (ex != null) {
                    log.warn("주기 refresh 실패: {}", ex.getMessage());
                }
            });
        } catch (RuntimeException e) {
            log.error("주기 refresh 점검 중 오류", e);
        }
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdownNow();
    }
}
