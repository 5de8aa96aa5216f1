package com.inkblog.backend.auth.identity.password.event;

import java.time.LocalDateTime;

/**
 * 재설정 링크를 저장한 뒤, 커밋이 끝나면 메일을 보내기 위해 발행하는 이벤트
 * - 토큰 원문은 DB에 없으므로 이 이벤트가 원문을 들고 있는 유일한 곳이다.
 */
public record PasswordResetIssuedEvent(String email, String nickname, String rawToken, LocalDateTime expiresAt) {}
