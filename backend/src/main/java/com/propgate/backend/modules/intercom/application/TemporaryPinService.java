package com.propgate.backend.modules.intercom.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.intercom.domain.TemporaryPin;
import com.propgate.backend.modules.intercom.infrastructure.persistence.TemporaryPinRepository;
import com.propgate.backend.modules.property.domain.AccessPoint;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional
public class TemporaryPinService {

    private static final Logger log = LoggerFactory.getLogger(TemporaryPinService.class);

    private final ActorResolver actorResolver;
    private final BuildingAccessPolicy buildingAccessPolicy;
    private final AccessPointRepository accessPointRepository;
    private final TemporaryPinRepository temporaryPinRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    public TemporaryPinService(
            ActorResolver actorResolver,
            BuildingAccessPolicy buildingAccessPolicy,
            AccessPointRepository accessPointRepository,
            TemporaryPinRepository temporaryPinRepository,
            PasswordEncoder passwordEncoder,
            Clock clock
    ) {
        this.actorResolver = actorResolver;
        this.buildingAccessPolicy = buildingAccessPolicy;
        this.accessPointRepository = accessPointRepository;
        this.temporaryPinRepository = temporaryPinRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
    }

    public TemporaryPinView createTemporaryPin(CreateTemporaryPinCommand command, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        CredentialFormat.requireValidPin(command.pin());
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.expiresAt() == null || !command.expiresAt().isAfter(now)) {
            throw ProblemException.invalid("EXPIRY_NOT_IN_FUTURE", "expiresAt must be in the future");
        }
        int maxUses = command.maxUses() == null ? 1 : command.maxUses();
        if (maxUses < 1) {
            throw ProblemException.invalid("INVALID_MAX_USES", "maxUses must be at least 1");
        }

        if (command.accessPointId() == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND");
        }
        AccessPoint accessPoint = accessPointRepository.findById(command.accessPointId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND"));
        if (!buildingAccessPolicy.hasBuildingAccess(
                actor.userId(), accessPoint.getBuildingId(), new ScopeResolutionContext())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "BUILDING_ACCESS_DENIED");
        }

        TemporaryPin pin = new TemporaryPin();
        pin.setAccessPointId(accessPoint.getId());
        pin.setCreatedBy(actor.userId());
        pin.setPinHash(passwordEncoder.encode(command.pin()));
        pin.setExpiresAt(command.expiresAt());
        pin.setMaxUses(maxUses);
        pin.setActive(true);
        TemporaryPin saved = temporaryPinRepository.save(pin);

        log.info("Temporary pin {} created on access point {} by user {} (maxUses={})",
                saved.getId(), accessPoint.getId(), actor.userId(), maxUses);
        return TemporaryPinView.from(saved);
    }

    public record CreateTemporaryPinCommand(
            Long accessPointId,
            String pin,
            OffsetDateTime expiresAt,
            Integer maxUses
    ) {
    }

    public record TemporaryPinView(
            Long id,
            Long accessPointId,
            OffsetDateTime expiresAt,
            int maxUses,
            int usesCount,
            boolean active
    ) {

        static TemporaryPinView from(TemporaryPin pin) {
            return new TemporaryPinView(
                    pin.getId(),
                    pin.getAccessPointId(),
                    pin.getExpiresAt(),
                    pin.getMaxUses(),
                    pin.getUsesCount(),
                    pin.isActive()
            );
        }
    }
}
