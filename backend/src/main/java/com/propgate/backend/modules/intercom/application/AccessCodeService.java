package com.propgate.backend.modules.intercom.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.intercom.domain.AccessCode;
import com.propgate.backend.modules.intercom.infrastructure.persistence.AccessCodeRepository;
import com.propgate.backend.modules.intercom.infrastructure.persistence.IdFilters;
import com.propgate.backend.modules.property.domain.AccessPoint;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.BuildingRepository;
import com.propgate.backend.modules.property.infrastructure.persistence.TenantAssignmentRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * 방문자 출입 코드 발급/수정/비활성화/삭제/조회.
 *
 * <p>입주자는 본인 배정 건물에만 발급할 수 있고 본인이 만든 코드만 관리한다.
 * 그 외 역할은 {@link BuildingAccessPolicy} 기준 접근 가능한 건물의 코드만 다룬다.
 */
@Service
@Transactional
public class AccessCodeService {

    private static final Logger log = LoggerFactory.getLogger(AccessCodeService.class);

    private final ActorResolver actorResolver;
    private final BuildingAccessPolicy buildingAccessPolicy;
    private final BuildingRepository buildingRepository;
    private final AccessPointRepository accessPointRepository;
    private final TenantAssignmentRepository tenantAssignmentRepository;
    private final AccessCodeRepository accessCodeRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final int maxPageSize;

    public AccessCodeService(
            ActorResolver actorResolver,
            BuildingAccessPolicy buildingAccessPolicy,
            BuildingRepository buildingRepository,
            AccessPointRepository accessPointRepository,
            TenantAssignmentRepository tenantAssignmentRepository,
            AccessCodeRepository accessCodeRepository,
            PasswordEncoder passwordEncoder,
            Clock clock,
            @Value("${app.access.log.max-page-size:100}") int maxPageSize
    ) {
        this.actorResolver = actorResolver;
        this.buildingAccessPolicy = buildingAccessPolicy;
        this.buildingRepository = buildingRepository;
        this.accessPointRepository = accessPointRepository;
        this.tenantAssignmentRepository = tenantAssignmentRepository;
        this.accessCodeRepository = accessCodeRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.maxPageSize = maxPageSize;
    }

    public AccessCodeView createAccessCode(CreateAccessCodeCommand command, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        CredentialFormat.requireValidCode(command.code());
        OffsetDateTime now = OffsetDateTime.now(clock);
        validateWindow(command.validFrom(), command.expiresAt(), command.expiresAt() != null, now);

        ScopeResolutionContext context = new ScopeResolutionContext();
        Long buildingId;
        Long tenantUserId = command.tenantUserId();
        if (actor.isTenant()) {
            buildingId = buildingAccessPolicy.findTenantBuildingId(actor.userId())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "TENANT_BUILDING_NOT_ASSIGNED"));
            if (command.buildingId() != null && !command.buildingId().equals(buildingId)) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "BUILDING_ACCESS_DENIED");
            }
            if (tenantUserId != null && !tenantUserId.equals(actor.userId())) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ACCESS_CODE_FORBIDDEN");
            }
            tenantUserId = actor.userId();
        } else {
            if (command.buildingId() == null) {
                throw ProblemException.invalid("BUILDING_REQUIRED", "buildingId is required");
            }
            buildingId = command.buildingId();
            if (!buildingRepository.existsById(buildingId)) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "BUILDING_NOT_FOUND");
            }
            if (!buildingAccessPolicy.hasBuildingAccess(actor.userId(), buildingId, context)) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "BUILDING_ACCESS_DENIED");
            }
        }

        if (command.accessPointId() != null) {
            requireAccessPointInBuilding(command.accessPointId(), buildingId);
        }
        if (tenantUserId != null
                && !tenantAssignmentRepository.existsByTenantUserIdAndBuildingIdAndActiveTrue(tenantUserId, buildingId)) {
            throw ProblemException.invalid("TENANT_NOT_IN_BUILDING", "tenant is not assigned to this building");
        }

        AccessCode code = new AccessCode();
        code.setBuildingId(buildingId);
        code.setAccessPointId(command.accessPointId());
        code.setTenantUserId(tenantUserId);
        code.setCodeHash(passwordEncoder.encode(command.code()));
        code.setCodePlain(command.code());
        code.setValidFrom(command.validFrom());
        code.setExpiresAt(command.expiresAt());
        code.setSingleUse(command.singleUse());
        code.setActive(true);
        code.setCreatedBy(actor.userId());
        AccessCode saved = accessCodeRepository.save(code);

        log.info("Access code {} created for building {} by user {}", saved.getId(), buildingId, actor.userId());
        return AccessCodeView.from(saved);
    }

    public AccessCodeView updateAccessCode(Long accessCodeId, UpdateAccessCodeCommand command, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        AccessCode code = loadManageableCode(accessCodeId, actor);
        OffsetDateTime now = OffsetDateTime.now(clock);

        if (command.code() != null) {
            CredentialFormat.requireValidCode(command.code());
        }
        OffsetDateTime validFrom = command.validFrom() != null ? command.validFrom() : code.getValidFrom();
        OffsetDateTime expiresAt = command.expiresAt() != null ? command.expiresAt() : code.getExpiresAt();
        validateWindow(validFrom, expiresAt, command.expiresAt() != null, now);

        if (command.code() != null) {
            code.setCodeHash(passwordEncoder.encode(command.code()));
            code.setCodePlain(command.code());
        }
        code.setValidFrom(validFrom);
        code.setExpiresAt(expiresAt);
        if (command.singleUse() != null) {
            code.setSingleUse(command.singleUse());
        }
        log.info("Access code {} updated by user {}", code.getId(), actor.userId());
        return AccessCodeView.from(code);
    }

    /**
     * 활성 상태를 반전한다(비활성화/재활성화). 이미 사용된 1회용 코드는 재활성화하지 않는다.
     */
    public AccessCodeView toggleAccessCode(Long accessCodeId, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        AccessCode code = loadManageableCode(accessCodeId, actor);
        if (!code.isActive() && code.isConsumed()) {
            throw new ProblemException(
                    HttpStatus.CONFLICT,
                    "ACCESS_CODE_CONSUMED",
                    "a used single-use code cannot be reactivated"
            );
        }
        code.setActive(!code.isActive());
        log.info("Access code {} {} by user {}", code.getId(), code.isActive() ? "activated" : "deactivated", actor.userId());
        return AccessCodeView.from(code);
    }

    public void deleteAccessCode(Long accessCodeId, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        AccessCode code = loadManageableCode(accessCodeId, actor);
        accessCodeRepository.delete(code);
        log.info("Access code {} deleted by user {}", code.getId(), actor.userId());
    }

    @Transactional(readOnly = true)
    public Page<AccessCodeView> listAccessCodes(AccessCodeQuery query, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        Pageable pageable = PageRequest.of(Math.max(query.page(), 0), clampPageSize(query.size()));

        boolean restrict = false;
        List<Long> buildingIds = IdFilters.UNRESTRICTED;
        Long createdBy = null;
        if (actor.isTenant()) {
            createdBy = actor.userId();
        } else if (!actor.isSuperAdmin()) {
            Optional<Set<Long>> accessible = buildingAccessPolicy.accessibleBuildingIds(
                    actor.userId(), new ScopeResolutionContext());
            if (accessible.isPresent()) {
                if (accessible.get().isEmpty()) {
                    return Page.empty(pageable);
                }
                restrict = true;
                buildingIds = List.copyOf(accessible.get());
            }
        }
        return accessCodeRepository.search(
                        restrict,
                        buildingIds,
                        createdBy,
                        query.buildingId(),
                        query.accessPointId(),
                        pageable
                )
                .map(AccessCodeView::from);
    }

    private AccessCode loadManageableCode(Long accessCodeId, Actor actor) {
        AccessCode code = accessCodeRepository.findById(Objects.requireNonNull(accessCodeId, "accessCodeId is required"))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_CODE_NOT_FOUND"));
        if (actor.isSuperAdmin()) {
            return code;
        }
        if (actor.isTenant()) {
            if (!actor.userId().equals(code.getCreatedBy())) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ACCESS_CODE_FORBIDDEN");
            }
            return code;
        }
        if (!buildingAccessPolicy.hasBuildingAccess(actor.userId(), code.getBuildingId(), new ScopeResolutionContext())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ACCESS_CODE_FORBIDDEN");
        }
        return code;
    }

    private void requireAccessPointInBuilding(Long accessPointId, Long buildingId) {
        AccessPoint accessPoint = accessPointRepository.findById(accessPointId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND"));
        if (!buildingId.equals(accessPoint.getBuildingId())) {
            throw ProblemException.invalid("ACCESS_POINT_BUILDING_MISMATCH", "access point does not belong to the building");
        }
    }

    private static void validateWindow(
            OffsetDateTime validFrom,
            OffsetDateTime expiresAt,
            boolean expiryChanged,
            OffsetDateTime now
    ) {
        if (expiresAt == null) {
            return;
        }
        if (expiryChanged && !expiresAt.isAfter(now)) {
            throw ProblemException.invalid("EXPIRY_NOT_IN_FUTURE", "expiresAt must be in the future");
        }
        if (validFrom != null && !expiresAt.isAfter(validFrom)) {
            throw ProblemException.invalid("EXPIRY_BEFORE_VALID_FROM", "expiresAt must be after validFrom");
        }
    }

    private int clampPageSize(int size) {
        return Math.min(Math.max(size, 1), maxPageSize);
    }

    public record CreateAccessCodeCommand(
            Long buildingId,
            Long accessPointId,
            Long tenantUserId,
            String code,
            boolean singleUse,
            OffsetDateTime validFrom,
            OffsetDateTime expiresAt
    ) {
    }

    public record UpdateAccessCodeCommand(
            String code,
            Boolean singleUse,
            OffsetDateTime validFrom,
            OffsetDateTime expiresAt
    ) {
    }

    public record AccessCodeQuery(Long buildingId, Long accessPointId, int page, int size) {
    }

    public record AccessCodeView(
            Long id,
            Long buildingId,
            Long accessPointId,
            Long tenantUserId,
            String code,
            String codeType,
            OffsetDateTime validFrom,
            OffsetDateTime expiresAt,
            boolean singleUse,
            boolean active,
            OffsetDateTime consumedAt,
            Long createdBy,
            OffsetDateTime createdAt
    ) {

        static AccessCodeView from(AccessCode code) {
            return new AccessCodeView(
                    code.getId(),
                    code.getBuildingId(),
                    code.getAccessPointId(),
                    code.getTenantUserId(),
                    // rows created before code_plain existed only have the hash
                    code.getCodePlain() != null ? code.getCodePlain() : code.getCodeHash(),
                    code.getCodeType(),
                    code.getValidFrom(),
                    code.getExpiresAt(),
                    code.isSingleUse(),
                    code.isActive(),
                    code.getConsumedAt(),
                    code.getCreatedBy(),
                    code.getCreatedAt()
            );
        }
    }
}
