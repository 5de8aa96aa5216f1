package com.inkblog.backend.auth.identity.support;

public final class IdentityPatterns {

    private IdentityPatterns() {}

    // 9~64자, 영문+숫자 포함, 특수문자 1개 이상, 공백 금지
    // - 특수문자는 "영문/숫자/공백"이 아닌 문자로 정의
    public static final String PASSWORD_REGEX =
            "^(?=.*[A-Za-z])(?=.*\\d)(?=.*[^A-Za-z0-9\\s])\\S{9,64}$";

    // 닉네임: 2~20자, 한글/영문/숫자/_ 만
    public static final String NICKNAME_REGEX =
            "^[A-Za-z0-9가-힣_]{2,20}$";
}
