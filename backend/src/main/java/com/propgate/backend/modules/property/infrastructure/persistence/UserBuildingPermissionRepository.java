package com.propgate.backend.modules.property.infrastructure.persistence;

import java.util.List;

import com.propgate.backend.modules.property.domain.UserBuildingPermission;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserBuildingPermissionRepository extends JpaRepository<UserBuildingPermission, Long> {

    boolean existsByUserIdAndBuildingIdAndActiveTrue(Long userId, Long buildingId);

    @Query("""
            select distinct p.buildingId
              from UserBuildingPermission p
             where p.userId = :userId
               and p.active = true
            """)
    List<Long> findActiveBuildingIds(@Param("userId") Long userId);
}
