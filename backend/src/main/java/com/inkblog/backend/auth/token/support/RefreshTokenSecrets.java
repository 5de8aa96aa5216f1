package com.inkblog.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * refresh token 원문 생성 + 저장용 해시
 *
 * - 원문: SecureRandom 48바이트 -> Base64url(padding 없음), 64자. 클라이언트에게 한 번만 내려간다.
 * - DB에는 SHA-256 hex(소문자 64자)만 저장하고, 들어온 원문은 같은 해시로 바꿔 token_hash 로 찾는다.
 * - 원문 엔트로피가 충분해서 salt나 느린 해시는 쓰지 않는다.
 */
@Component
@RequiredArgsConstructor
public class RefreshTokenSecrets {

    public static final int RAW_BYTES = 48;

    private static final Base64.Encoder RAW_ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom;

    public String newRaw() {
        byte[] bytes = new byte[RAW_BYTES];
        secureRandom.nextBytes(bytes);
        return RAW_ENCODER.encodeToString(bytes);
    }

    public static String hashOf(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("raw token must not be blank");
        }
        return HEX.formatHex(sha256().digest(raw.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
