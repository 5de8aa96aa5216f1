package com.inkblog.backend.auth.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.inkblog.backend.auth.domain.User;

import jakarta.persistence.LockModeType;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    boolean existsByEmail(String email);
    
    boolean existsByNickname(String nickname);
    
    Optional<User> findByEmail(String email);

    /**
     * 유저 단위 직렬화용 Row Lock 조회 (SELECT ... FOR UPDATE)
     *
     * - refresh 발급/로테이션/쿼터 정리는 항상 "users row 잠금 -> refresh_tokens 변경" 순서로 진행한다.
     * - 같은 유저의 동시 로그인 두 건이 둘 다 "쿼터 여유 있음"으로 보고 초과 발급하는 것을 막는다.
     * - 잠금 순서가 한 방향이라 refresh/로그인/로그아웃-올 사이에 데드락이 생기지 않는다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.id = :id")
    Optional<User> findByIdForUpdate(@Param("id") Long id);

    /**
     * 로그인 실패 카운터 갱신용 Row Lock 조회
     * - 동시에 틀린 비밀번호가 여러 번 들어와도 카운터가 유실되지 않게 한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from User u where u.email = :email")
    Optional<User> findByEmailForUpdate(@Param("email") String email);
}
