package com.inkblog.client.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.inkblog.client.auth.AccessTokenRefresher.TokenResult;

import lombok.extern.slf4j.Slf4j;

/**
 * 클라이언트 refresh 단일 비행(single-flight) 조정기
 *
 * 동시에 여러 요청이 "access 만료"를 발견해도 refresh 네트워크 호출은 한 번만 나간다.
 * 서버가 rotation을 하면 같은 refresh token으로 두 번 호출하는 순간 둘 중 하나는 REFRESH_INVALID가 되므로,
 * 클라이언트 쪽에서도 한 번에 하나만 보내야 한다.
 *
 * 상태:
 * - IDLE: 진행 중인 refresh 없음
 * - REFRESHING: refresh 1건 진행 중. 이때 들어온 호출자는 waiters에 합류만 하고 새 호출을 만들지 않는다.
 * - 직전 결과(lastOutcome): RESOLVED / FAILED (아직 한 번도 안 돌았으면 null)
 *
 * 결과 전달:
 * - 성공: 새 토큰을 CredentialStore에 먼저 저장한 뒤, 대기자 전원에게 같은 access token을 넘긴다.
 * - 실패: CredentialStore를 비우고(강제 로그아웃), 대기자 전원에게 같은 RefreshFailedException을 넘긴다.
 *   삭제와 상태 복귀(IDLE)는 같은 임계구역에서 일어난다. 그 사이에 다른 스레드가 "저장소는 비었는데 REFRESHING"인 상태를 보지 않는다.
 *   refresh에 쓴 자격 증명이 아직 저장소에 있을 때만 지운다. (그 사이 재로그인으로 저장된 새 값은 유지)
 * - refresh 자체의 타임아웃은 두지 않는다. (AccessTokenRefresher 구현의 네트워크 타임아웃을 따른다)
 */
@Slf4j
public class RefreshCoordinator {

    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofMinutes(5);

    public enum State { IDLE, REFRESHING }

    public enum Outcome { RESOLVED, FAILED }

    private final AccessTokenRefresher refresher;
    private final CredentialStore credentialStore;
    private final TokenExpiryReader expiryReader;
    private final Executor executor;
    private final Clock clock;
    private final Duration safetyMargin;

    private final Object lock = new Object();

    // lock 으로 보호
    private State state = State.IDLE;
    private Outcome lastOutcome;
    private List<CompletableFuture<String>> waiters = new ArrayList<>();

    public RefreshCoordinator(AccessTokenRefresher refresher,
                              CredentialStore credentialStore,
                              TokenExpiryReader expiryReader,
                              Executor executor,
                              Clock clock) {
        this(refresher, credentialStore, expiryReader, executor, clock, DEFAULT_SAFETY_MARGIN);
    }

    public RefreshCoordinator(AccessTokenRefresher refresher,
                              CredentialStore credentialStore,
                              TokenExpiryReader expiryReader,
                              Executor executor,
                              Clock clock,
                              Duration safetyMargin) {
        this.refresher = Objects.requireNonNull(refresher, "refresher");
        this.credentialStore = Objects.requireNonNull(credentialStore, "credentialStore");
        this.expiryReader = Objects.requireNonNull(expiryReader, "expiryReader");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.safetyMargin = Objects.requireNonNull(safetyMargin, "safetyMargin");
        if (safetyMargin.isNegative()) {
            throw new IllegalArgumentException("safetyMargin must not be negative: " + safetyMargin);
        }
    }

    /**
     * 유효한 access token을 돌려준다.
     *
     * - 현재 토큰의 exp가 now + safetyMargin 보다 뒤면 즉시 완료된 future
     * - refresh가 이미 진행 중이면 그 결과를 기다리는 future (새 호출 없음)
     * - 아니면 refresh를 시작하고 그 결과를 기다리는 future
     * - 저장된 자격 증명이 없으면 RefreshFailedException(NO_CREDENTIALS)로 실패한 future
     */
    public CompletableFuture<String> ensureValidToken() {
        CompletableFuture<String> waiter;
        Credentials credentials;

        // 판단(토큰 재조회 포함)과 상태 전이를 한 임계구역에서 처리한다.
        // 직전 refresh가 막 끝난 경우에도 새 토큰을 보게 되어, 이미 rotation된 refresh token을 다시 보내지 않는다.
        synchronized (lock) {
            Optional<Credentials> current = credentialStore.current();
            if (current.isEmpty()) {
                return CompletableFuture.failedFuture(RefreshFailedException.noCredentials());
            }

            credentials = current.get();
            if (isFresh(credentials.accessToken())) {
                return CompletableFuture.completedFuture(credentials.accessToken());
            }

            waiter = new CompletableFuture<>();
            waiters.add(waiter);

            if (state == State.REFRESHING) {
                log.debug("refresh 진행 중, 대기열 합류: waiters={}", waiters.size());
                return waiter;
            }

            state = State.REFRESHING;
        }

        startRefresh(credentials);
        return waiter;
    }

    // 자격 증명이 있는지 (주기 점검에서 로그아웃 상태면 건너뛰기 위해)
    public boolean hasCredentials() {
        return credentialStore.current().isPresent();
    }

    public State state() {
        synchronized (lock) {
            return state;
        }
    }

    public Outcome lastOutcome() {
        synchronized (lock) {
            return lastOutcome;
        }
    }

    public int pendingWaiters() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private boolean isFresh(String accessToken) {
        Instant threshold = clock.instant().plus(safetyMargin);
        return expiryReader.readExpiry(accessToken)
                .map(exp -> exp.isAfter(threshold))
                .orElse(false);
    }

    private void startRefresh(Credentials used) {
        log.debug("access token 만료 임박, refresh 시작");
        try {
            executor.execute(() -> runRefresh(used));
        } catch (RejectedExecutionException e) {
            fail(used, new RefreshFailedException("refresh 실행기를 사용할 수 없습니다.", null, 0, e));
        }
    }

    private void runRefresh(Credentials used) {
        TokenResult result;
        try {
            result = refresher.refresh(used.refreshToken());
        } catch (RefreshFailedException e) {
            fail(used, e);
            return;
        } catch (RuntimeException e) {
            fail(used, new RefreshFailedException("refresh 중 예기치 못한 오류: " + e.getMessage(), null, 0, e));
            return;
        }

        try {
            // 대기자를 깨우기 전에 저장: 깨어난 호출자가 다음 요청에서 새 토큰을 보게 된다.
            credentialStore.save(new Credentials(result.accessToken(), result.refreshToken()));
        } catch (RuntimeException e) {
            fail(used, new RefreshFailedException("새 자격 증명 저장 실패", null, 0, e));
            return;
        }

        List<CompletableFuture<String>> toResolve = drain(Outcome.RESOLVED);
        log.debug("refresh 성공: waiters={}", toResolve.size());
        for (CompletableFuture<String> w : toResolve) {
            w.complete(result.accessToken());
        }
    }

    private void fail(Credentials used, RefreshFailedException failure) {
        List<CompletableFuture<String>> toReject;
        boolean cleared;
        synchronized (lock) {
            cleared = credentialStore.clearIfCurrent(used);
            toReject = drain(Outcome.FAILED);
        }

        log.warn("refresh 실패: code={}, status={}, credentialsCleared={}, waiters={}",
                failure.getCode(), failure.getStatus(), cleared, toReject.size());
        for (CompletableFuture<String> w : toReject) {
            w.completeExceptionally(failure);
        }
    }

    private List<CompletableFuture<String>> drain(Outcome outcome) {
        synchronized (lock) {
            List<CompletableFuture<String>> drained = waiters;
            waiters = new ArrayList<>();
            state = State.IDLE;
            lastOutcome = outcome;
            return drained;
        }
    }
}
