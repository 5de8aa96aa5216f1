package com.inkblog.backend.auth.identity.support;

import java.util.Locale;

public final class EmailUtils {

    private EmailUtils() {}

    // 입력 이메일을 trim + 소문자로 정규화 (가입/로그인 모두 같은 규칙)
    public static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
