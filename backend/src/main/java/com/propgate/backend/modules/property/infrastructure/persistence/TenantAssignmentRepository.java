package com.propgate.backend.modules.property.infrastructure.persistence;

import java.util.Optional;

import com.propgate.backend.modules.property.domain.TenantAssignment;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TenantAssignmentRepository extends JpaRepository<TenantAssignment, Long> {

    Optional<TenantAssignment> findFirstByTenantUserIdAndActiveTrueOrderByIdDesc(Long tenantUserId);

    boolean existsByTenantUserIdAndBuildingIdAndActiveTrue(Long tenantUserId, Long buildingId);
}
