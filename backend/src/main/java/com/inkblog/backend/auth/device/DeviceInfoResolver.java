package com.inkblog.backend.auth.device;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * HTTP 요청 -> DeviceInfo 변환
 *
 * - 컨트롤러에서만 호출한다. 서비스 계층은 HttpServletRequest를 모른다.
 * - IP: X-Forwarded-For가 있으면 첫 번째 hop, 없으면 remoteAddr
 */
@Component
@RequiredArgsConstructor
public class DeviceInfoResolver {

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final DeviceClassifier deviceClassifier;

    public DeviceInfo resolve(HttpServletRequest request) {
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        return new DeviceInfo(userAgent, resolveClientIp(request), deviceClassifier.classify(userAgent));
    }

    private static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(X_FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) return first;
        }
        return request.getRemoteAddr();
    }
}
