package com.inkblog.client.auth;

import java.util.Objects;

// 클라이언트가 들고 있는 토큰 한 쌍
public record Credentials(String accessToken, String refreshToken) {

    public Credentials {
        Objects.requireNonNull(accessToken, "accessToken");
        Objects.requireNonNull(refreshToken, "refreshToken");
    }

    @Override
    public String toString() {
        return "Credentials[accessToken=***, refreshToken=***]";
    }
}
