package com.propgate.backend.modules.intercom.application;

import static com.propgate.backend.support.TestEntities.accessPoint;
import static com.propgate.backend.support.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.auth.domain.ActorRole;
import com.propgate.backend.modules.intercom.application.AccessCodeService.AccessCodeQuery;
import com.propgate.backend.modules.intercom.application.AccessCodeService.AccessCodeView;
import com.propgate.backend.modules.intercom.application.AccessCodeService.CreateAccessCodeCommand;
import com.propgate.backend.modules.intercom.application.AccessCodeService.UpdateAccessCodeCommand;
import com.propgate.backend.modules.intercom.domain.AccessCode;
import com.propgate.backend.modules.intercom.infrastructure.persistence.AccessCodeRepository;
import com.propgate.backend.modules.intercom.infrastructure.persistence.IdFilters;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.BuildingRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.TenantAssignmentRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AccessCodeServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-06-01T09:00:00Z");

    @Mock
    private ActorResolver actorResolver;

    @Mock
    private BuildingAccessPolicy buildingAccessPolicy;

    @Mock
    private BuildingRepository buildingRepository;

    @Mock
    private AccessPointRepository accessPointRepository;

    @Mock
    private TenantAssignmentRepository tenantAssignmentRepository;

    @Mock
    private AccessCodeRepository accessCodeRepository;

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private AccessCodeService service;

    @BeforeEach
    void setUp() {
        service = new AccessCodeService(
                actorResolver,
                buildingAccessPolicy,
                buildingRepository,
                accessPointRepository,
                tenantAssignmentRepository,
                accessCodeRepository,
                passwordEncoder,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC),
                100
        );
        lenient().when(actorResolver.resolve(1L)).thenReturn(new Actor(1L, ActorRole.SUPER_ADMIN));
        lenient().when(actorResolver.resolve(2L)).thenReturn(new Actor(2L, ActorRole.PROPERTY_MANAGER));
        lenient().when(actorResolver.resolve(7L)).thenReturn(new Actor(7L, ActorRole.TENANT));
        lenient().when(accessCodeRepository.save(any(AccessCode.class)))
                .thenAnswer(invocation -> withId(invocation.<AccessCode>getArgument(0), 500L));
    }

    @Test
    @DisplayName("관리자는 접근 가능한 건물에 해시된 코드를 발급한다")
    void managerCreatesHashedCode() {
        when(buildingRepository.existsById(100L)).thenReturn(true);
        when(buildingAccessPolicy.hasBuildingAccess(eq(2L), eq(100L), any(ScopeResolutionContext.class))).thenReturn(true);
        when(accessPointRepository.findById(10L)).thenReturn(Optional.of(accessPoint(10L, 100L)));

        AccessCodeView view = service.createAccessCode(
                new CreateAccessCodeCommand(100L, 10L, null, "4729", true, null, NOW.plusDays(1)), 2L);

        ArgumentCaptor<AccessCode> captor = ArgumentCaptor.forClass(AccessCode.class);
        verify(accessCodeRepository).save(captor.capture());
        AccessCode saved = captor.getValue();
        assertThat(saved.getCodeHash()).isNotEqualTo("4729");
        assertThat(passwordEncoder.matches("4729", saved.getCodeHash())).isTrue();
        assertThat(saved.isSingleUse()).isTrue();
        assertThat(saved.getCreatedBy()).isEqualTo(2L);
        assertThat(view.id()).isEqualTo(500L);
        assertThat(view.code()).isEqualTo("4729");
    }

    @Test
    @DisplayName("만료 시각이 현재보다 이전이면 저장 전에 거부한다")
    void rejectsPastExpiry() {
        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(100L, null, null, "4729", false, null, NOW.minusMinutes(1)), 2L))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("EXPIRY_NOT_IN_FUTURE");
        verify(accessCodeRepository, never()).save(any());
    }

    @Test
    @DisplayName("만료 시각은 유효 시작 시각보다 뒤여야 한다")
    void rejectsExpiryBeforeValidFrom() {
        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(100L, null, null, "4729", false, NOW.plusDays(2), NOW.plusDays(1)), 2L))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("EXPIRY_BEFORE_VALID_FROM");
    }

    @Test
    @DisplayName("코드 길이가 4자 미만이면 거부한다")
    void rejectsShortCode() {
        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(100L, null, null, "12", false, null, null), 2L))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    @DisplayName("입주자는 다른 건물에 코드를 발급할 수 없다")
    void tenantCannotTargetOtherBuilding() {
        when(buildingAccessPolicy.findTenantBuildingId(7L)).thenReturn(Optional.of(100L));

        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(200L, null, null, "4729", false, null, null), 7L))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    @DisplayName("입주자가 만든 코드는 배정 건물과 본인으로 고정된다")
    void tenantCodeIsBoundToOwnBuilding() {
        when(buildingAccessPolicy.findTenantBuildingId(7L)).thenReturn(Optional.of(100L));
        when(tenantAssignmentRepository.existsByTenantUserIdAndBuildingIdAndActiveTrue(7L, 100L)).thenReturn(true);

        AccessCodeView view = service.createAccessCode(
                new CreateAccessCodeCommand(null, null, null, "visitor-1", true, null, NOW.plusHours(3)), 7L);

        assertThat(view.buildingId()).isEqualTo(100L);
        assertThat(view.tenantUserId()).isEqualTo(7L);
    }

    @Test
    @DisplayName("다른 건물의 인터폰을 지정하면 거부한다")
    void rejectsAccessPointOfAnotherBuilding() {
        when(buildingRepository.existsById(100L)).thenReturn(true);
        when(buildingAccessPolicy.hasBuildingAccess(eq(2L), eq(100L), any(ScopeResolutionContext.class))).thenReturn(true);
        when(accessPointRepository.findById(11L)).thenReturn(Optional.of(accessPoint(11L, 300L)));

        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(100L, 11L, null, "4729", false, null, null), 2L))
                .isInstanceOf(ProblemException.class);
    }

    @Test
    @DisplayName("건물 접근 권한이 없는 관리자는 발급할 수 없다")
    void managerWithoutBuildingAccessIsForbidden() {
        when(buildingRepository.existsById(100L)).thenReturn(true);
        when(buildingAccessPolicy.hasBuildingAccess(eq(2L), eq(100L), any(ScopeResolutionContext.class))).thenReturn(false);

        assertThatThrownBy(() -> service.createAccessCode(
                new CreateAccessCodeCommand(100L, null, null, "4729", false, null, null), 2L))
                .isInstanceOf(ResponseStatusException.class);
    }

    @Test
    @DisplayName("활성 상태 토글은 입주자 본인이 만든 코드에만 허용된다")
    void toggleRequiresCreatorForTenants() {
        AccessCode own = existingCode(31L, 7L);
        AccessCode foreign = existingCode(32L, 8L);
        when(accessCodeRepository.findById(31L)).thenReturn(Optional.of(own));
        when(accessCodeRepository.findById(32L)).thenReturn(Optional.of(foreign));

        AccessCodeView toggled = service.toggleAccessCode(31L, 7L);

        assertThat(toggled.active()).isFalse();
        assertThat(service.toggleAccessCode(31L, 7L).active()).isTrue();
        assertThatThrownBy(() -> service.toggleAccessCode(32L, 7L)).isInstanceOf(ResponseStatusException.class);
    }

    @Test
    @DisplayName("이미 사용된 1회용 코드는 다시 활성화할 수 없다")
    void consumedSingleUseCodeCannotBeReactivated() {
        AccessCode consumed = existingCode(33L, 7L);
        consumed.markConsumed(NOW.minusHours(1));
        when(accessCodeRepository.findById(33L)).thenReturn(Optional.of(consumed));

        assertThatThrownBy(() -> service.toggleAccessCode(33L, 7L))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(consumed.isActive()).isFalse();
    }

    @Test
    @DisplayName("수정 시 새 코드와 유효 기간을 검증 후 반영한다")
    void updateRehashesCodeAndWindow() {
        AccessCode code = existingCode(40L, 2L);
        when(accessCodeRepository.findById(40L)).thenReturn(Optional.of(code));
        when(buildingAccessPolicy.hasBuildingAccess(eq(2L), eq(100L), any(ScopeResolutionContext.class))).thenReturn(true);

        service.updateAccessCode(40L, new UpdateAccessCodeCommand("8080", false, null, NOW.plusDays(3)), 2L);

        assertThat(passwordEncoder.matches("8080", code.getCodeHash())).isTrue();
        assertThat(code.getExpiresAt()).isEqualTo(NOW.plusDays(3));
        assertThat(code.isSingleUse()).isFalse();
    }

    @Test
    @DisplayName("최고 관리자는 어떤 코드든 삭제할 수 있다")
    void superAdminDeletesAnyCode() {
        AccessCode code = existingCode(41L, 9L);
        when(accessCodeRepository.findById(41L)).thenReturn(Optional.of(code));

        service.deleteAccessCode(41L, 1L);

        verify(accessCodeRepository).delete(code);
    }

    @Test
    @DisplayName("없는 코드는 NotFound")
    void missingCodeIsNotFound() {
        when(accessCodeRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteAccessCode(99L, 1L))
                .isInstanceOf(ResponseStatusException.class)
                .extracting(ex -> ((ResponseStatusException) ex).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    @DisplayName("관리자 목록은 접근 가능한 건물로 제한되고 입주자는 본인 코드만 본다")
    void listingIsScoped() {
        when(buildingAccessPolicy.accessibleBuildingIds(eq(2L), any(ScopeResolutionContext.class)))
                .thenReturn(Optional.of(Set.of(100L)));
        Page<AccessCode> page = new PageImpl<>(List.of(existingCode(50L, 2L)));
        when(accessCodeRepository.search(eq(true), eq(List.of(100L)), isNull(), isNull(), isNull(), any(Pageable.class)))
                .thenReturn(page);
        when(accessCodeRepository.search(eq(false), eq(IdFilters.UNRESTRICTED), eq(7L), isNull(), isNull(), any(Pageable.class)))
                .thenReturn(Page.empty());

        assertThat(service.listAccessCodes(new AccessCodeQuery(null, null, 0, 20), 2L).getContent())
                .extracting(AccessCodeView::id)
                .containsExactly(50L);
        assertThat(service.listAccessCodes(new AccessCodeQuery(null, null, 0, 20), 7L)).isEmpty();
    }

    @Test
    @DisplayName("접근 가능한 건물이 없으면 조회하지 않고 빈 페이지를 반환한다")
    void emptyAccessibleBuildingsShortCircuits() {
        when(buildingAccessPolicy.accessibleBuildingIds(eq(2L), any(ScopeResolutionContext.class)))
                .thenReturn(Optional.of(Set.of()));

        assertThat(service.listAccessCodes(new AccessCodeQuery(null, null, 0, 20), 2L)).isEmpty();
        verify(accessCodeRepository, never()).search(anyBoolean(), any(), any(), any(), any(), any());
    }

    private AccessCode existingCode(long id, long createdBy) {
        AccessCode code = new AccessCode();
        code.setBuildingId(100L);
        code.setCodeHash(passwordEncoder.encode("0000"));
        code.setCodePlain("0000");
        code.setSingleUse(true);
        code.setActive(true);
        code.setCreatedBy(createdBy);
        return withId(code, id);
    }
}
