package com.inkblog.client.auth;

import java.io.IOException;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * access token(JWT)의 exp 클레임만 읽는다.
 *
 * - 서명은 검증하지 않는다. 클라이언트는 키를 모르고, "곧 만료되니 미리 refresh 할지" 판단에만 쓴다.
 * - 형식이 깨졌거나 exp가 없으면 empty (호출 측은 만료로 취급)
 */
public class TokenExpiryReader {

    private final ObjectMapper objectMapper;

    public TokenExpiryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<Instant> readExpiry(String jwt) {
        if (jwt == null || jwt.isBlank()) return Optional.empty();

        String[] parts = jwt.split("\\.");
        if (parts.length < 2 || parts[1].isEmpty()) return Optional.empty();

        try {
            byte[] payload = Base64.getUrlDecoder().decode(parts[1]);
            JsonNode exp = objectMapper.readTree(payload).get("exp");
            if (exp == null || !exp.canConvertToLong()) return Optional.empty();
            return Optional.of(Instant.ofEpochSecond(exp.asLong()));
        } catch (IllegalArgumentException | IOException e) {
            return Optional.empty();
        }
    }
}
