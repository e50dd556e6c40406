package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.FaceBiometric;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FaceBiometricRepository extends JpaRepository<FaceBiometric, Long> {

    @Query("""
            select fb
              from FaceBiometric fb
             where fb.active = true
               and fb.frontImageHash = :frontHash
               and fb.leftImageHash = :leftHash
               and fb.rightImageHash = :rightHash
             order by fb.id desc
            """)
    List<FaceBiometric> findActiveByHashes(
            @Param("frontHash") String frontHash,
            @Param("leftHash") String leftHash,
            @Param("rightHash") String rightHash
    );

    Optional<FaceBiometric> findFirstByUserIdAndActiveTrueOrderByIdDesc(Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update FaceBiometric fb set fb.active = false where fb.userId = :userId and fb.active = true")
    int deactivateActiveForUser(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from FaceBiometric fb where fb.userId = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
