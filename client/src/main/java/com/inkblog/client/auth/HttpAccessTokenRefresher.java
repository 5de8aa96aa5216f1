package com.inkblog.client.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * POST {baseUrl}/auth/refresh 호출 구현
 *
 * - 요청: {"refreshToken": "..."}
 * - 2xx: {accessToken, refreshToken, expiresIn, user} 중 토큰 필드만 읽는다.
 * - 그 외: ApiError 본문의 code를 RefreshFailedException에 실어 던진다. (본문이 JSON이 아니면 code=null)
 */
@Slf4j
public class HttpAccessTokenRefresher implements AccessTokenRefresher {

    static final String REFRESH_PATH = "/auth/refresh";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI refreshUri;
    private final Duration requestTimeout;

    public HttpAccessTokenRefresher(HttpClient httpClient, ObjectMapper objectMapper, URI baseUrl, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");

        String base = Objects.requireNonNull(baseUrl, "baseUrl").toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.refreshUri = URI.create(base + REFRESH_PATH);
    }

    @Override
    public TokenResult refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw RefreshFailedException.noCredentials();
        }

        HttpRequest request = HttpRequest.newBuilder(refreshUri)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(Map.of("refreshToken", refreshToken)), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RefreshFailedException("refresh 요청 전송 실패: " + e.getMessage(), null, 0, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RefreshFailedException("refresh 요청 대기 중 인터럽트", null, 0, e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            String code = readErrorCode(response.body());
            log.debug("refresh 거부: status={}, code={}", status, code);
            throw new RefreshFailedException("refresh 거부: status=" + status + ", code=" + code, code, status);
        }

        return readTokenResult(response.body(), status);
    }

    private TokenResult readTokenResult(String body, int status) {
        try {
            JsonNode root = objectMapper.readTree(body);
            String accessToken = root.path("accessToken").asText(null);
            String newRefreshToken = root.path("refreshToken").asText(null);
            long expiresIn = root.path("expiresIn").asLong(0);

            if (accessToken == null || accessToken.isBlank() || newRefreshToken == null || newRefreshToken.isBlank()) {
                throw new RefreshFailedException("refresh 응답에 토큰이 없습니다.", null, status);
            }
            return new TokenResult(accessToken, newRefreshToken, expiresIn);
        } catch (JsonProcessingException e) {
            throw new RefreshFailedException("refresh 응답 파싱 실패", null, status, e);
        }
    }

    private String readErrorCode(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return objectMapper.readTree(body).path("code").asText(null);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("refresh 요청 직렬화 실패", e);
        }
    }
}
