package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;

import com.propgate.backend.modules.intercom.domain.AccessLog;
import com.propgate.backend.modules.intercom.domain.CredentialType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessLogRepository extends JpaRepository<AccessLog, Long> {

    @Query("""
            select al
              from AccessLog al
             where (:restrictAccessPoints = false or al.accessPointId in :accessPointIds)
               and (:accessPointId is null or al.accessPointId = :accessPointId)
               and (:userId is null or al.userId = :userId)
               and (:success is null or al.success = :success)
               and (:credentialType is null or al.credentialType = :credentialType)
               and (
                    :codeId is null
                 or (al.credentialType = com.propgate.backend.modules.intercom.domain.CredentialType.ACCESS_CODE
                     and al.credentialRefId = :codeId)
               )
               and (:from is null or al.occurredAt >= :from)
               and (:to is null or al.occurredAt <= :to)
             order by al.occurredAt desc, al.id desc
            """)
    Page<AccessLog> search(
            @Param("restrictAccessPoints") boolean restrictAccessPoints,
            @Param("accessPointIds") Collection<Long> accessPointIds,
            @Param("accessPointId") Long accessPointId,
            @Param("userId") Long userId,
            @Param("success") Boolean success,
            @Param("credentialType") CredentialType credentialType,
            @Param("codeId") Long codeId,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            Pageable pageable
    );
}
