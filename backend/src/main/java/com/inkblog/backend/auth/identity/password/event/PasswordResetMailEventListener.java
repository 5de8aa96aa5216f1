package com.inkblog.backend.auth.identity.password.event;

import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import com.inkblog.backend.auth.identity.password.service.PasswordResetMailSender;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class PasswordResetMailEventListener {

    private final PasswordResetMailSender mailSender;

    // 커밋된 링크만 메일로 나간다. (롤백이면 발송 없음)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void on(PasswordResetIssuedEvent event) {
        try {
            mailSender.sendResetLink(event.email(), event.nickname(), event.rawToken());
        } catch (Exception e) {
            // 발급은 이미 커밋됨. 사용자는 다시 요청하면 된다.
            log.error("비밀번호 재설정 메일 발송 실패. email={}", event.email(), e);
        }
    }
}
