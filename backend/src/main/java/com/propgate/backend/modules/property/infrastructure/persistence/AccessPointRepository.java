package com.propgate.backend.modules.property.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.propgate.backend.modules.property.domain.AccessPoint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessPointRepository extends JpaRepository<AccessPoint, Long> {

    @Query("""
            select ap.id
              from AccessPoint ap
             where ap.buildingId in :buildingIds
            """)
    List<Long> findIdsByBuildingIds(@Param("buildingIds") Collection<Long> buildingIds);
}
