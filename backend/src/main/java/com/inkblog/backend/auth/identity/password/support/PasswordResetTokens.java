package com.inkblog.backend.auth.identity.password.support;

import java.security.SecureRandom;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

import com.inkblog.backend.auth.token.support.RefreshTokenSecrets;

import lombok.RequiredArgsConstructor;

/**
 * 재설정 토큰 원문 생성 + 저장용 해시
 *
 * - 원문: SecureRandom 32바이트 -> hex(소문자 64자). URL에 그대로 실어 보낸다.
 * - 저장: refresh token과 같은 SHA-256 hex
 */
@Component
@RequiredArgsConstructor
public class PasswordResetTokens {

    public static final int RAW_BYTES = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom;

    public String newRaw() {
        byte[] bytes = new byte[RAW_BYTES];
        secureRandom.nextBytes(bytes);
        return HEX.formatHex(bytes);
    }

    public static String hashOf(String raw) {
        return RefreshTokenSecrets.hashOf(raw);
    }
}
