package com.asnswap.backend.auth.repo;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.asnswap.backend.auth.domain.LoginOtp;

@Repository
public interface LoginOtpRepository extends JpaRepository<LoginOtp, Long> {

    Optional<LoginOtp> findByEmailAndCode(String email, String code);

    /**
     * 벌크 삭제 (DELETE ... WHERE email = ?)
     *
     * 파생 deleteBy... 가 아니라 JPQL 벌크 쿼리를 쓰는 이유:
     * - Hibernate는 flush 시 INSERT를 DELETE보다 먼저 내보낸다.
     *   엔티티 remove 후 같은 트랜잭션에서 save 하면 email UNIQUE에 걸린다.
     * - 벌크 쿼리는 호출 즉시 실행되므로 "삭제 -> 삽입" 순서가 보장된다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from LoginOtp o where o.email = :email")
    int deleteAllByEmail(@Param("email") String email);

    /**
     * 비교 후 삭제(compare-and-delete)
     * - (email, code)가 그대로 남아있을 때만 지운다.
     * - 동시 검증 요청 중 1건만 1을 받고, 나머지는 0을 받는다.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from LoginOtp o where o.email = :email and o.code = :code")
    int deleteByEmailAndCode(@Param("email") String email, @Param("code") String code);
}
