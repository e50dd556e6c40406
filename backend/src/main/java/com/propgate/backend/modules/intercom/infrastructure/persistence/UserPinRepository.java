package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.UserPin;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserPinRepository extends JpaRepository<UserPin, Long> {

    @Query("""
            select up
              from UserPin up
             where up.accessPointId = :accessPointId
               and up.active = true
               and exists (
                    select 1
                      from PortalUser pu
                     where pu.id = up.userId
                       and pu.active = true
               )
             order by up.id
            """)
    List<UserPin> findActiveForAccessPoint(@Param("accessPointId") Long accessPointId);

    Optional<UserPin> findFirstByAccessPointIdAndUserIdOrderByIdDesc(Long accessPointId, Long userId);
}
