package com.inkblog.backend.auth.device;

/**
 * refresh 세션 발급 시점의 기기 정보 스냅샷
 *
 * - userAgent: 원본 User-Agent (저장 시 255자로 잘림)
 * - ipAddress: 클라이언트 IP (프록시 뒤라면 X-Forwarded-For 첫 번째 값)
 * - deviceClass: UA 기반 추정값
 */
public record DeviceInfo(String userAgent, String ipAddress, DeviceClass deviceClass) {

    public DeviceInfo {
        if (deviceClass == null) deviceClass = DeviceClass.UNKNOWN;
    }

    // 요청 컨텍스트 없이 발급하는 경우(배치/테스트)
    public static DeviceInfo unknown() {
        return new DeviceInfo(null, null, DeviceClass.UNKNOWN);
    }
}
