package com.propgate.backend.modules.intercom.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.propgate.backend.modules.intercom.application.AccessAuditLogger.AccessLogCommand;
import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.domain.MasterPin;
import com.propgate.backend.modules.intercom.domain.UserPin;
import com.propgate.backend.modules.intercom.infrastructure.persistence.MasterPinRepository;
import com.propgate.backend.modules.intercom.infrastructure.persistence.UserPinRepository;
import com.propgate.backend.modules.property.domain.AccessPoint;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * 마스터 PIN / 사용자 PIN 설정. 변경 내역은 출입 로그에도 남긴다.
 */
@Service
@Transactional
public class PinManagementService {

    static final String REASON_MASTER_UPDATED = "Master pin set/updated";
    static final String REASON_OWN_PIN_UPDATED = "Own pin set/updated";
    static final String REASON_USER_PIN_UPDATED_BY_ADMIN = "User pin set/updated by admin";

    private static final Logger log = LoggerFactory.getLogger(PinManagementService.class);

    private final ActorResolver actorResolver;
    private final AccessPointRepository accessPointRepository;
    private final PortalUserRepository portalUserRepository;
    private final MasterPinRepository masterPinRepository;
    private final UserPinRepository userPinRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccessAuditLogger accessAuditLogger;
    private final Clock clock;

    public PinManagementService(
            ActorResolver actorResolver,
            AccessPointRepository accessPointRepository,
            PortalUserRepository portalUserRepository,
            MasterPinRepository masterPinRepository,
            UserPinRepository userPinRepository,
            PasswordEncoder passwordEncoder,
            AccessAuditLogger accessAuditLogger,
            Clock clock
    ) {
        this.actorResolver = actorResolver;
        this.accessPointRepository = accessPointRepository;
        this.portalUserRepository = portalUserRepository;
        this.masterPinRepository = masterPinRepository;
        this.userPinRepository = userPinRepository;
        this.passwordEncoder = passwordEncoder;
        this.accessAuditLogger = accessAuditLogger;
        this.clock = clock;
    }

    public void setOrUpdateMasterPin(Long accessPointId, String pin, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        if (!actor.isSuperAdmin()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "MASTER_PIN_ADMIN_ONLY");
        }
        CredentialFormat.requireValidPin(pin);
        AccessPoint accessPoint = loadAccessPoint(accessPointId);

        MasterPin masterPin = masterPinRepository.findFirstByAccessPointIdOrderByIdDesc(accessPoint.getId())
                .orElseGet(MasterPin::new);
        masterPin.setAccessPointId(accessPoint.getId());
        masterPin.setPinHash(passwordEncoder.encode(pin));
        masterPin.setActive(true);
        masterPin.setUpdatedBy(actor.userId());
        MasterPin saved = masterPinRepository.save(masterPin);

        recordChange(accessPoint.getId(), actor.userId(), CredentialType.MASTER, saved.getId(), REASON_MASTER_UPDATED);
        log.info("Master pin updated for access point {} by user {}", accessPoint.getId(), actor.userId());
    }

    /**
     * Sets a user's pin. Acting on another user requires super admin plus the current master pin.
     */
    public void setOrUpdateUserPin(
            Long accessPointId,
            Long targetUserId,
            String pin,
            Long actingUserId,
            String masterPin
    ) {
        Actor actor = actorResolver.resolve(actingUserId);
        if (targetUserId == null) {
            throw ProblemException.invalid("USER_REQUIRED", "target user is required");
        }
        boolean self = targetUserId.equals(actor.userId());
        if (!self && !actor.isSuperAdmin()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "PIN_ACTION_FORBIDDEN");
        }
        CredentialFormat.requireValidPin(pin);
        AccessPoint accessPoint = loadAccessPoint(accessPointId);
        if (!self) {
            verifyMasterPin(accessPoint.getId(), masterPin);
        }

        PortalUser target = portalUserRepository.findById(targetUserId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        if (!target.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "USER_INACTIVE", "target user is inactive");
        }

        UserPin saved = upsertUserPin(accessPoint.getId(), target.getId(), pin, actor.userId());
        recordChange(
                accessPoint.getId(),
                target.getId(),
                CredentialType.USER,
                saved.getId(),
                self ? REASON_OWN_PIN_UPDATED : REASON_USER_PIN_UPDATED_BY_ADMIN
        );
        log.info("User pin updated for user {} on access point {} by user {}",
                target.getId(), accessPoint.getId(), actor.userId());
    }

    /**
     * 본인 PIN 변경. 기존 활성 PIN 이 있으면 이전 PIN 확인이 필요하다.
     */
    public void updateOwnPin(Long accessPointId, Long actingUserId, String newPin, String oldPin) {
        Actor actor = actorResolver.resolve(actingUserId);
        CredentialFormat.requireValidPin(newPin);
        AccessPoint accessPoint = loadAccessPoint(accessPointId);

        userPinRepository.findFirstByAccessPointIdAndUserIdOrderByIdDesc(accessPoint.getId(), actor.userId())
                .filter(UserPin::isActive)
                .ifPresent(existing -> {
                    if (oldPin == null || oldPin.isBlank()) {
                        throw ProblemException.invalid("OLD_PIN_REQUIRED", "current pin is required");
                    }
                    if (!passwordEncoder.matches(oldPin, existing.getPinHash())) {
                        throw new ResponseStatusException(HttpStatus.FORBIDDEN, "INVALID_OLD_PIN");
                    }
                });

        UserPin saved = upsertUserPin(accessPoint.getId(), actor.userId(), newPin, actor.userId());
        recordChange(accessPoint.getId(), actor.userId(), CredentialType.USER, saved.getId(), REASON_OWN_PIN_UPDATED);
    }

    private void verifyMasterPin(Long accessPointId, String masterPin) {
        if (masterPin == null || masterPin.isBlank()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "MASTER_PIN_REQUIRED");
        }
        MasterPin current = masterPinRepository.findFirstByAccessPointIdAndActiveTrueOrderByIdDesc(accessPointId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "MASTER_PIN_NOT_CONFIGURED"));
        if (!passwordEncoder.matches(masterPin, current.getPinHash())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "INVALID_MASTER_PIN");
        }
    }

    private UserPin upsertUserPin(Long accessPointId, Long userId, String pin, Long updatedBy) {
        UserPin userPin = userPinRepository.findFirstByAccessPointIdAndUserIdOrderByIdDesc(accessPointId, userId)
                .orElseGet(UserPin::new);
        userPin.setAccessPointId(accessPointId);
        userPin.setUserId(userId);
        userPin.setPinHash(passwordEncoder.encode(pin));
        userPin.setActive(true);
        userPin.setUpdatedBy(updatedBy);
        return userPinRepository.save(userPin);
    }

    private AccessPoint loadAccessPoint(Long accessPointId) {
        if (accessPointId == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND");
        }
        return accessPointRepository.findById(accessPointId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND"));
    }

    private void recordChange(Long accessPointId, Long userId, CredentialType type, Long refId, String reason) {
        accessAuditLogger.record(new AccessLogCommand(
                accessPointId,
                userId,
                type,
                refId,
                true,
                reason,
                null,
                null,
                OffsetDateTime.now(clock)
        ));
    }
}
