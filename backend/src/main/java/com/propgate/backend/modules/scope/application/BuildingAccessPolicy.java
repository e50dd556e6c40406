package com.propgate.backend.modules.scope.application;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.modules.auth.domain.ActorRole;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.property.domain.Building;
import com.propgate.backend.modules.property.domain.TenantAssignment;
import com.propgate.backend.modules.property.infrastructure.persistence.BuildingRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.TenantAssignmentRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.UserBuildingPermissionRepository;
import com.propgate.backend.modules.scope.domain.ResolvedScope;
import com.propgate.backend.modules.scope.domain.ScopeMode;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Building-level access used by credential management and face verification.
 *
 * <ul>
 *   <li>super admins reach every building</li>
 *   <li>tenants reach only the building of their active assignment</li>
 *   <li>everyone else needs an explicit permission, ownership, or a PM/OWN scope covering
 *       the building's owner or creator</li>
 * </ul>
 * The ALL flag widens row visibility only; it never grants building management on its own.
 */
@Component
public class BuildingAccessPolicy {

    private final ScopeResolver scopeResolver;
    private final ScopeFilter scopeFilter;
    private final BuildingRepository buildingRepository;
    private final UserBuildingPermissionRepository userBuildingPermissionRepository;
    private final TenantAssignmentRepository tenantAssignmentRepository;

    public BuildingAccessPolicy(
            ScopeResolver scopeResolver,
            ScopeFilter scopeFilter,
            BuildingRepository buildingRepository,
            UserBuildingPermissionRepository userBuildingPermissionRepository,
            TenantAssignmentRepository tenantAssignmentRepository
    ) {
        this.scopeResolver = scopeResolver;
        this.scopeFilter = scopeFilter;
        this.buildingRepository = buildingRepository;
        this.userBuildingPermissionRepository = userBuildingPermissionRepository;
        this.tenantAssignmentRepository = tenantAssignmentRepository;
    }

    @Transactional(readOnly = true)
    public boolean hasBuildingAccess(Long userId, Long buildingId, ScopeResolutionContext context) {
        if (userId == null || buildingId == null) {
            return false;
        }
        Optional<PortalUser> user = scopeResolver.loadUser(userId, context);
        if (user.isEmpty() || !user.get().isActive()) {
            return false;
        }
        ActorRole role = ActorRole.of(user.get().getUserType());
        if (role == ActorRole.SUPER_ADMIN) {
            return true;
        }
        if (role == ActorRole.TENANT) {
            return findTenantBuildingId(userId).map(buildingId::equals).orElse(false);
        }
        if (userBuildingPermissionRepository.existsByUserIdAndBuildingIdAndActiveTrue(userId, buildingId)) {
            return true;
        }
        Optional<Building> building = buildingRepository.findById(buildingId);
        if (building.isEmpty()) {
            return false;
        }
        if (userId.equals(building.get().getOwnerId())) {
            return true;
        }
        ResolvedScope scope = scopeResolver.resolveScope(userId, context);
        if (scope.mode() == ScopeMode.ALL) {
            return false;
        }
        return scopeFilter.hasAccess(building.get(), userId, context) || scope.permits(building.get().getOwnerId());
    }

    /**
     * Buildings the user may manage, or empty when unrestricted (super admin).
     */
    @Transactional(readOnly = true)
    public Optional<Set<Long>> accessibleBuildingIds(Long userId, ScopeResolutionContext context) {
        Optional<PortalUser> user = scopeResolver.loadUser(userId, context);
        if (user.isEmpty() || !user.get().isActive()) {
            return Optional.of(Set.of());
        }
        ActorRole role = ActorRole.of(user.get().getUserType());
        if (role == ActorRole.SUPER_ADMIN) {
            return Optional.empty();
        }
        if (role == ActorRole.TENANT) {
            return Optional.of(findTenantBuildingId(userId).map(Set::of).orElse(Set.of()));
        }
        Set<Long> buildingIds = new LinkedHashSet<>(userBuildingPermissionRepository.findActiveBuildingIds(userId));
        buildingIds.addAll(buildingRepository.findOwnedBuildingIds(userId));
        ResolvedScope scope = scopeResolver.resolveScope(userId, context);
        if (scope.mode() == ScopeMode.PM && !scope.ecosystemUserIds().isEmpty()) {
            buildingIds.addAll(buildingRepository.findIdsOwnedOrCreatedByAny(scope.ecosystemUserIds()));
        }
        return Optional.of(buildingIds);
    }

    @Transactional(readOnly = true)
    public Optional<Long> findTenantBuildingId(Long tenantUserId) {
        return tenantAssignmentRepository.findFirstByTenantUserIdAndActiveTrueOrderByIdDesc(tenantUserId)
                .map(TenantAssignment::getBuildingId);
    }
}
