package com.inkblog.backend.auth.device;

import java.util.List;
import java.util.Locale;

/**
 * 키워드 매칭 기반 기본 분류기
 *
 * 판정 순서:
 * - 비어있음 -> UNKNOWN
 * - mobile / android / iphone -> MOBILE
 * - tablet / ipad -> TABLET
 * - 그 외 -> DESKTOP
 *
 * 안드로이드 태블릿처럼 "android"만 있고 "mobile"이 없는 UA도 MOBILE로 떨어진다. (키워드 순서 그대로)
 */
public class UserAgentDeviceClassifier implements DeviceClassifier {

    private static final List<String> MOBILE_KEYWORDS = List.of("mobile", "android", "iphone");
    private static final List<String> TABLET_KEYWORDS = List.of("tablet", "ipad");

    @Override
    public DeviceClass classify(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return DeviceClass.UNKNOWN;
        }

        String ua = userAgent.toLowerCase(Locale.ROOT);

        if (containsAny(ua, MOBILE_KEYWORDS)) return DeviceClass.MOBILE;
        if (containsAny(ua, TABLET_KEYWORDS)) return DeviceClass.TABLET;
        return DeviceClass.DESKTOP;
    }

    private static boolean containsAny(String ua, List<String> keywords) {
        for (String k : keywords) {
            if (ua.contains(k)) return true;
        }
        return false;
    }
}
