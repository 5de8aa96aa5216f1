package com.inkblog.backend.auth.device;

/**
 * User-Agent 문자열 -> DeviceClass 추정
 * - best-effort. 분류가 틀려도 인증 결과에는 영향이 없다.
 */
public interface DeviceClassifier {

    DeviceClass classify(String userAgent);
}
