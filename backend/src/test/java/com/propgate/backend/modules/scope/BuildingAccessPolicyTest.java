package com.propgate.backend.modules.scope;

import static com.propgate.backend.support.TestEntities.building;
import static com.propgate.backend.support.TestEntities.frontDeskType;
import static com.propgate.backend.support.TestEntities.propertyManagerType;
import static com.propgate.backend.support.TestEntities.superAdminType;
import static com.propgate.backend.support.TestEntities.tenantType;
import static com.propgate.backend.support.TestEntities.user;
import static com.propgate.backend.support.TestEntities.userType;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.propgate.backend.modules.auth.domain.DataAccessControl;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.propgate.backend.modules.property.domain.TenantAssignment;
import com.propgate.backend.modules.property.infrastructure.persistence.BuildingRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.TenantAssignmentRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.UserBuildingPermissionRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;
import com.propgate.backend.modules.scope.application.ScopeFilter;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;
import com.propgate.backend.modules.scope.application.ScopeResolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BuildingAccessPolicyTest {

    @Mock
    private PortalUserRepository portalUserRepository;

    @Mock
    private BuildingRepository buildingRepository;

    @Mock
    private UserBuildingPermissionRepository userBuildingPermissionRepository;

    @Mock
    private TenantAssignmentRepository tenantAssignmentRepository;

    private BuildingAccessPolicy policy;
    private final Map<Long, PortalUser> users = new HashMap<>();

    @BeforeEach
    void setUp() {
        ScopeResolver scopeResolver = new ScopeResolver(portalUserRepository);
        policy = new BuildingAccessPolicy(
                scopeResolver,
                new ScopeFilter(scopeResolver),
                buildingRepository,
                userBuildingPermissionRepository,
                tenantAssignmentRepository
        );
        lenient().when(portalUserRepository.findWithTypeById(any()))
                .thenAnswer(invocation -> Optional.ofNullable(users.get(invocation.<Long>getArgument(0))));
        lenient().when(portalUserRepository.findEcosystemMemberIds(any())).thenReturn(List.of());
    }

    private void register(PortalUser user) {
        users.put(user.getId(), user);
    }

    @Test
    @DisplayName("최고 관리자는 모든 건물에 접근한다")
    void superAdminReachesEveryBuilding() {
        register(user(1L, superAdminType(), null, null));

        assertThat(policy.hasBuildingAccess(1L, 500L, new ScopeResolutionContext())).isTrue();
        assertThat(policy.accessibleBuildingIds(1L, new ScopeResolutionContext())).isEmpty();
    }

    @Test
    @DisplayName("입주자는 배정된 건물에만 접근한다")
    void tenantReachesAssignedBuildingOnly() {
        register(user(7L, tenantType(), null, null));
        TenantAssignment assignment = new TenantAssignment();
        assignment.setTenantUserId(7L);
        assignment.setBuildingId(100L);
        when(tenantAssignmentRepository.findFirstByTenantUserIdAndActiveTrueOrderByIdDesc(7L))
                .thenReturn(Optional.of(assignment));

        assertThat(policy.hasBuildingAccess(7L, 100L, new ScopeResolutionContext())).isTrue();
        assertThat(policy.hasBuildingAccess(7L, 101L, new ScopeResolutionContext())).isFalse();
    }

    @Test
    @DisplayName("명시적 권한이 있으면 접근할 수 있다")
    void explicitPermissionGrantsAccess() {
        register(user(3L, frontDeskType(), null, null));
        when(userBuildingPermissionRepository.existsByUserIdAndBuildingIdAndActiveTrue(3L, 100L)).thenReturn(true);

        assertThat(policy.hasBuildingAccess(3L, 100L, new ScopeResolutionContext())).isTrue();
    }

    @Test
    @DisplayName("PM 생태계 직원은 루트 PM 소유 건물에 접근한다")
    void ecosystemStaffReachesManagersBuilding() {
        register(user(10L, propertyManagerType(), null, null));
        register(user(11L, frontDeskType(), 10L, null));
        when(portalUserRepository.findEcosystemMemberIds(10L)).thenReturn(List.of(11L));
        when(buildingRepository.findById(100L)).thenReturn(Optional.of(building(100L, 10L, 1L)));

        assertThat(policy.hasBuildingAccess(11L, 100L, new ScopeResolutionContext())).isTrue();
    }

    @Test
    @DisplayName("생태계 밖 건물과 비활성 사용자는 거부된다")
    void outsidersAndInactiveUsersAreDenied() {
        register(user(10L, propertyManagerType(), null, null));
        PortalUser inactive = user(12L, propertyManagerType(), null, null);
        inactive.setActive(false);
        register(inactive);
        when(buildingRepository.findById(200L)).thenReturn(Optional.of(building(200L, 99L, 99L)));

        assertThat(policy.hasBuildingAccess(10L, 200L, new ScopeResolutionContext())).isFalse();
        assertThat(policy.hasBuildingAccess(12L, 200L, new ScopeResolutionContext())).isFalse();
        assertThat(policy.hasBuildingAccess(404L, 200L, new ScopeResolutionContext())).isFalse();
    }

    @Test
    @DisplayName("ALL 플래그만으로는 건물 관리 권한이 생기지 않는다")
    void allFlagAloneDoesNotGrantBuildingAccess() {
        register(user(5L, userType(9L, "AUDITOR", DataAccessControl.ALL), null, null));
        when(buildingRepository.findById(100L)).thenReturn(Optional.of(building(100L, 10L, 10L)));

        assertThat(policy.hasBuildingAccess(5L, 100L, new ScopeResolutionContext())).isFalse();
    }

    @Test
    @DisplayName("접근 가능한 건물은 권한, 소유, 생태계 건물을 합친 집합이다")
    void accessibleBuildingsUnionPermissionsOwnershipAndEcosystem() {
        register(user(10L, propertyManagerType(), null, null));
        when(userBuildingPermissionRepository.findActiveBuildingIds(10L)).thenReturn(List.of(1L));
        when(buildingRepository.findOwnedBuildingIds(10L)).thenReturn(List.of(2L));
        when(portalUserRepository.findEcosystemMemberIds(10L)).thenReturn(List.of(11L));
        when(buildingRepository.findIdsOwnedOrCreatedByAny(any())).thenReturn(List.of(2L, 3L));

        assertThat(policy.accessibleBuildingIds(10L, new ScopeResolutionContext()))
                .hasValueSatisfying(ids -> assertThat(ids).containsExactlyInAnyOrder(1L, 2L, 3L));
    }
}
