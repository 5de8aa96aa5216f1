package com.inkblog.client.auth;

import java.util.Optional;

/**
 * 클라이언트 측 자격 증명 보관소
 *
 * 구현체는 여러 스레드에서 동시에 호출될 수 있다.
 */
public interface CredentialStore {

    Optional<Credentials> current();

    void save(Credentials credentials);

    // 강제 로그아웃: 이후 current()는 empty
    void clear();

    /**
     * 지금 보관 중인 값이 expected 와 같을 때만 비운다.
     * refresh 실패 처리 도중 다른 경로(재로그인)가 저장한 새 자격 증명은 지우지 않기 위해 쓴다.
     *
     * @return 비웠으면 true
     */
    default boolean clearIfCurrent(Credentials expected) {
        if (expected == null || !current().map(expected::equals).orElse(false)) {
            return false;
        }
        clear();
        return true;
    }
}
