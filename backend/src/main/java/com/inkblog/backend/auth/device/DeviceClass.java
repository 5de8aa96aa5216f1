package com.inkblog.backend.auth.device;

/**
 * refresh 세션이 발급된 기기의 대략적인 분류 (User-Agent 추정값)
 *
 * 보안 판단에는 쓰지 않는다. 세션 목록 표시/운영 통계용.
 */
public enum DeviceClass { MOBILE, TABLET, DESKTOP, UNKNOWN }
