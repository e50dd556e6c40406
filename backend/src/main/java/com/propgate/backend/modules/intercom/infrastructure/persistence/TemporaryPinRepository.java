package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.TemporaryPin;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TemporaryPinRepository extends JpaRepository<TemporaryPin, Long> {

    @Query("""
            select tp.id as id, tp.pinHash as hash
              from TemporaryPin tp
             where tp.accessPointId = :accessPointId
               and tp.active = true
               and tp.expiresAt > :now
               and tp.usesCount < tp.maxUses
             order by tp.createdAt desc, tp.id desc
            """)
    List<CredentialHashView> findUsableCandidates(
            @Param("accessPointId") Long accessPointId,
            @Param("now") OffsetDateTime now
    );

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select tp from TemporaryPin tp where tp.id = :id")
    Optional<TemporaryPin> findByIdForUpdate(@Param("id") Long id);
}
