package com.propgate.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.auth.domain.PortalUser;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PortalUserRepository extends JpaRepository<PortalUser, Long> {

    @EntityGraph(attributePaths = "userType")
    @Query("select pu from PortalUser pu where pu.id = :id")
    Optional<PortalUser> findWithTypeById(@Param("id") Long id);

    @Query("""
            select pu.id
              from PortalUser pu
             where pu.invitedByUserId = :rootId
                or pu.createdByUserId = :rootId
            """)
    List<Long> findEcosystemMemberIds(@Param("rootId") Long rootId);
}
