package com.inkblog.backend.auth.token.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

// 만료된 refresh 레코드 주기 삭제 (요청 처리 경로와 무관하게 돈다)
@Slf4j
@Component
@RequiredArgsConstructor
public class RefreshTokenSweeper {

    private final RefreshTokenStore refreshTokenStore;

    @Scheduled(fixedDelayString = "${app.auth.refresh.sweep-interval:PT1H}")
    public void sweepExpired() {
        int deleted = refreshTokenStore.sweepExpired();
        if (deleted > 0) {
            log.info("만료 refresh 레코드 삭제: count={}", deleted);
        }
    }
}
