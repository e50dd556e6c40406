package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.AccessCode;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessCodeRepository extends JpaRepository<AccessCode, Long> {

    /**
     * 해당 인터폰에서 현재 유효한 코드 후보. 인터폰 지정 코드와 건물 전체 코드를 함께 반환하며 최신 생성 순이다.
     */
    @Query("""
            select ac.id as id, ac.codeHash as hash
              from AccessCode ac
             where ac.active = true
               and (ac.validFrom is null or ac.validFrom <= :now)
               and (ac.expiresAt is null or ac.expiresAt > :now)
               and (
                    ac.accessPointId = :accessPointId
                 or (ac.accessPointId is null and ac.buildingId = :buildingId)
               )
             order by ac.createdAt desc, ac.id desc
            """)
    List<CredentialHashView> findValidCandidates(
            @Param("accessPointId") Long accessPointId,
            @Param("buildingId") Long buildingId,
            @Param("now") OffsetDateTime now
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select ac from AccessCode ac where ac.id = :id")
    Optional<AccessCode> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select ac
              from AccessCode ac
             where (:restrictBuildings = false or ac.buildingId in :buildingIds)
               and (:createdBy is null or ac.createdBy = :createdBy)
               and (:buildingId is null or ac.buildingId = :buildingId)
               and (:accessPointId is null or ac.accessPointId = :accessPointId)
             order by ac.createdAt desc, ac.id desc
            """)
    Page<AccessCode> search(
            @Param("restrictBuildings") boolean restrictBuildings,
            @Param("buildingIds") Collection<Long> buildingIds,
            @Param("createdBy") Long createdBy,
            @Param("buildingId") Long buildingId,
            @Param("accessPointId") Long accessPointId,
            Pageable pageable
    );
}
