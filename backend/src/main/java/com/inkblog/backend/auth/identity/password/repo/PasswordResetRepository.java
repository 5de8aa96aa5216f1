package com.inkblog.backend.auth.identity.password.repo;

import java.time.LocalDateTime;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.inkblog.backend.auth.identity.password.domain.PasswordReset;

/**
 * password_resets 저장소
 *
 * 사용 처리(used_at 기록)는 refresh_tokens와 같은 "조건부 UPDATE + affected rows" 방식이다.
 * 같은 링크로 동시에 두 번 재설정해도 1을 받는 쪽은 하나뿐이다.
 */
@Repository
public interface PasswordResetRepository extends JpaRepository<PasswordReset, Long> {

    Optional<PasswordReset> findByTokenHash(String tokenHash);

    // 시간당 요청 제한용: since 이후에 만들어진 row 수 (사용/폐기 여부와 무관)
    long countByUserIdAndCreatedAtAfter(Long userId, LocalDateTime since);

    @Query("""
            select p from PasswordReset p
             where p.tokenHash = :tokenHash
               and p.usedAt is null
               and p.expiresAt > :now
            """)
    Optional<PasswordReset> findUsable(@Param("tokenHash") String tokenHash, @Param("now") LocalDateTime now);

    // mark-used-if-usable (CAS)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PasswordReset p
               set p.usedAt = :now
             where p.id = :id
               and p.usedAt is null
               and p.expiresAt > :now
            """)
    int markUsedIfUsable(@Param("id") Long id, @Param("now") LocalDateTime now);

    // 아직 쓸 수 있는 링크를 전부 사용 처리 (새 링크 발급 직전, 재설정 성공 직후)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update PasswordReset p
               set p.usedAt = :now
             where p.userId = :userId
               and p.usedAt is null
               and p.expiresAt > :now
            """)
    int revokeOutstanding(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    /**
     * 발급 직전 정리
     * - 요청 제한 창(windowStart) 밖의 row 중 만료됐거나 사용된 것만 지운다.
     * - 창 안의 row는 상태와 상관없이 남겨야 요청 횟수가 맞는다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from PasswordReset p
             where p.userId = :userId
               and p.createdAt <= :windowStart
               and (p.usedAt is not null or p.expiresAt <= :now)
            """)
    int deleteStaleByUserId(@Param("userId") Long userId,
                            @Param("now") LocalDateTime now,
                            @Param("windowStart") LocalDateTime windowStart);
}
