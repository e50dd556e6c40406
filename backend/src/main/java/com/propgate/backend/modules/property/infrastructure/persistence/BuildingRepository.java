package com.propgate.backend.modules.property.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.propgate.backend.modules.property.domain.Building;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BuildingRepository extends JpaRepository<Building, Long> {

    @Query("""
            select b.id
              from Building b
             where b.ownerId = :userId
                or b.createdBy = :userId
            """)
    List<Long> findOwnedBuildingIds(@Param("userId") Long userId);

    @Query("""
            select b.id
              from Building b
             where b.ownerId in :userIds
                or b.createdBy in :userIds
            """)
    List<Long> findIdsOwnedOrCreatedByAny(@Param("userIds") Collection<Long> userIds);
}
