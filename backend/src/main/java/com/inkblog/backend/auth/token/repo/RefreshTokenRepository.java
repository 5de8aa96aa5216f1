package com.inkblog.backend.auth.token.repo;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.inkblog.backend.auth.token.domain.RefreshRevokeReason;
import com.inkblog.backend.auth.token.domain.RefreshToken;

/**
 * refresh_tokens 저장소
 *
 * 상태 변경(touch/비활성화)은 전부 "조건부 UPDATE + affected rows" 방식이다.
 * - 반환값 1 = 내가 바꿨음(승자), 0 = 이미 다른 트랜잭션이 바꿨거나 조건 불일치(패자)
 * - 엔티티를 읽어서 필드를 바꾸는 더티체킹 방식은 "읽은 시점"과 "쓰는 시점" 사이에 끼어들 틈이 있어서 쓰지 않는다.
 *
 * @Modifying(flushAutomatically, clearAutomatically)
 * - 실행 전: 영속성 컨텍스트의 변경분(예: User 로그인 시각)을 먼저 flush
 * - 실행 후: 컨텍스트를 비워서 벌크 UPDATE 이전 상태의 엔티티를 재사용하지 않게 한다.
 */
@Repository
public interface RefreshTokenRepository extends JpaRepository<RefreshToken, Long> {

    Optional<RefreshToken> findByTokenHash(String tokenHash);

    long countByUserIdAndActiveTrue(Long userId);

    // token_hash 일치 + active + 미만료
    @Query("""
            select r from RefreshToken r
             where r.tokenHash = :tokenHash
               and r.active = true
               and r.expiresAt > :now
            """)
    Optional<RefreshToken> findActive(@Param("tokenHash") String tokenHash, @Param("now") LocalDateTime now);

    // 쿼터 계산용: 최신 발급 순 (created_at이 같으면 id로 순서 고정)
    @Query("""
            select r.id from RefreshToken r
             where r.userId = :userId
               and r.active = true
               and r.expiresAt > :now
             order by r.createdAt desc, r.id desc
            """)
    List<Long> findActiveIdsNewestFirst(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    /**
     * find-active-and-touch
     * - 여전히 active + 미만료일 때만 last_used_at 갱신
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.lastUsedAt = :now
             where r.id = :id
               and r.active = true
               and r.expiresAt > :now
            """)
    int touchIfUsable(@Param("id") Long id, @Param("now") LocalDateTime now);

    // deactivate-if-active (CAS)
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.active = false, r.revokedAt = :now, r.revokeReason = :reason
             where r.id = :id
               and r.active = true
            """)
    int deactivateIfActive(@Param("id") Long id,
                           @Param("now") LocalDateTime now,
                           @Param("reason") RefreshRevokeReason reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.active = false, r.revokedAt = :now, r.revokeReason = :reason
             where r.id in :ids
               and r.active = true
            """)
    int deactivateAllByIds(@Param("ids") Collection<Long> ids,
                           @Param("now") LocalDateTime now,
                           @Param("reason") RefreshRevokeReason reason);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update RefreshToken r
               set r.active = false, r.revokedAt = :now, r.revokeReason = :reason
             where r.userId = :userId
               and r.active = true
            """)
    int deactivateAllByUserId(@Param("userId") Long userId,
                              @Param("now") LocalDateTime now,
                              @Param("reason") RefreshRevokeReason reason);

    // 발급 직전 정리: 해당 유저의 만료 또는 비활성 레코드 삭제
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from RefreshToken r
             where r.userId = :userId
               and (r.active = false or r.expiresAt <= :now)
            """)
    int deleteExpiredOrInactiveByUserId(@Param("userId") Long userId, @Param("now") LocalDateTime now);

    // 스케줄 스윕: 전체 만료 레코드 삭제
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from RefreshToken r where r.expiresAt <= :now")
    int deleteAllExpired(@Param("now") LocalDateTime now);
}
