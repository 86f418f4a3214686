package com.asnswap.backend.profile.repo;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.asnswap.backend.profile.domain.UserProfile;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, Long> {

    Optional<UserProfile> findByEmail(String email);

    List<UserProfile> findAllByOrderByCreatedAtAsc();

    /**
     * 검색 필터 (전부 AND, 대소문자 무시 부분 일치)
     * - null 파라미터는 조건에서 빠진다.
     * - 패턴(%...%)은 호출 측에서 만들어 넘긴다. (와일드카드 이스케이프 포함)
     */
    @Query("""
            select p from UserProfile p
             where (:desiredRegion is null or lower(p.desiredRegion) like :desiredRegion escape '!')
               and (:currentRegion is null or lower(p.currentRegion) like :currentRegion escape '!')
               and (:agency is null or lower(p.agency) like :agency escape '!')
             order by p.createdAt asc
            """)
    List<UserProfile> search(
            @Param("desiredRegion") String desiredRegionPattern,
            @Param("currentRegion") String currentRegionPattern,
            @Param("agency") String agencyPattern);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from UserProfile p where p.email = :email")
    int deleteByEmail(@Param("email") String email);
}
