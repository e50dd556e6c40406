package com.propgate.backend.modules.intercom.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.intercom.domain.AccessLog;
import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.infrastructure.persistence.AccessLogRepository;
import com.propgate.backend.modules.intercom.infrastructure.persistence.IdFilters;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 출입 로그 조회. 최고 관리자는 전체, 그 외에는 접근 가능한 건물의 인터폰 로그만,
 * 입주자는 본인 기록만 볼 수 있다.
 */
@Service
@Transactional(readOnly = true)
public class AccessLogQueryService {

    private final ActorResolver actorResolver;
    private final BuildingAccessPolicy buildingAccessPolicy;
    private final AccessPointRepository accessPointRepository;
    private final AccessLogRepository accessLogRepository;
    private final int maxPageSize;

    public AccessLogQueryService(
            ActorResolver actorResolver,
            BuildingAccessPolicy buildingAccessPolicy,
            AccessPointRepository accessPointRepository,
            AccessLogRepository accessLogRepository,
            @Value("${app.access.log.max-page-size:100}") int maxPageSize
    ) {
        this.actorResolver = actorResolver;
        this.buildingAccessPolicy = buildingAccessPolicy;
        this.accessPointRepository = accessPointRepository;
        this.accessLogRepository = accessLogRepository;
        this.maxPageSize = maxPageSize;
    }

    public Page<AccessLogView> listAccessLogs(AccessLogFilter filter, int page, int size, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        if (filter.from() != null && filter.to() != null && filter.from().isAfter(filter.to())) {
            throw ProblemException.invalid("INVALID_DATE_RANGE", "from must not be after to");
        }
        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), maxPageSize));

        Optional<List<Long>> allowedAccessPoints = Optional.empty();
        if (!actor.isSuperAdmin()) {
            Optional<Set<Long>> buildings = buildingAccessPolicy.accessibleBuildingIds(
                    actor.userId(), new ScopeResolutionContext());
            if (buildings.isPresent()) {
                allowedAccessPoints = Optional.of(accessPointIdsOf(buildings.get()));
            }
        }
        if (filter.buildingId() != null) {
            List<Long> buildingAccessPoints = accessPointIdsOf(Set.of(filter.buildingId()));
            allowedAccessPoints = Optional.of(allowedAccessPoints
                    .map(allowed -> intersect(allowed, buildingAccessPoints))
                    .orElse(buildingAccessPoints));
        }
        if (allowedAccessPoints.isPresent() && allowedAccessPoints.get().isEmpty()) {
            return Page.empty(pageable);
        }

        Long userId = filter.userId();
        if (actor.isTenant()) {
            if (userId != null && !userId.equals(actor.userId())) {
                return Page.empty(pageable);
            }
            userId = actor.userId();
        }

        return accessLogRepository.search(
                        allowedAccessPoints.isPresent(),
                        allowedAccessPoints.orElse(IdFilters.UNRESTRICTED),
                        filter.accessPointId(),
                        userId,
                        filter.success(),
                        filter.credentialType(),
                        filter.codeId(),
                        filter.from(),
                        filter.to(),
                        pageable
                )
                .map(AccessLogView::from);
    }

    private List<Long> accessPointIdsOf(Set<Long> buildingIds) {
        if (buildingIds.isEmpty()) {
            return List.of();
        }
        return accessPointRepository.findIdsByBuildingIds(buildingIds);
    }

    private static List<Long> intersect(List<Long> left, List<Long> right) {
        List<Long> result = new ArrayList<>(left);
        result.retainAll(right);
        return result;
    }

    public record AccessLogFilter(
            Long buildingId,
            Long accessPointId,
            Long codeId,
            Long userId,
            Boolean success,
            CredentialType credentialType,
            OffsetDateTime from,
            OffsetDateTime to
    ) {

        public static AccessLogFilter none() {
            return new AccessLogFilter(null, null, null, null, null, null, null, null);
        }
    }

    public record AccessLogView(
            Long id,
            Long accessPointId,
            Long userId,
            String credentialType,
            Long credentialRefId,
            boolean success,
            String reason,
            String ipAddress,
            String deviceInfo,
            OffsetDateTime occurredAt
    ) {

        static AccessLogView from(AccessLog log) {
            return new AccessLogView(
                    log.getId(),
                    log.getAccessPointId(),
                    log.getUserId(),
                    log.getCredentialType().getLabel(),
                    log.getCredentialRefId(),
                    log.isSuccess(),
                    log.getReason(),
                    log.getIpAddress(),
                    log.getDeviceInfo(),
                    log.getOccurredAt()
            );
        }
    }
}
