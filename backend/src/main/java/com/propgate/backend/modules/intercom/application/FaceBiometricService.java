package com.propgate.backend.modules.intercom.application;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.auth.application.ActorResolver;
import com.propgate.backend.modules.auth.application.ActorResolver.Actor;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.propgate.backend.modules.intercom.application.FaceImageProcessor.FaceHashes;
import com.propgate.backend.modules.intercom.domain.FaceBiometric;
import com.propgate.backend.modules.intercom.domain.FacePayload;
import com.propgate.backend.modules.intercom.infrastructure.persistence.FaceBiometricRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * 얼굴 등록/재등록/삭제. 사용자당 활성 등록은 하나이며 재등록 시 이전 등록은 비활성화된다.
 */
@Service
@Transactional
public class FaceBiometricService {

    private static final Logger log = LoggerFactory.getLogger(FaceBiometricService.class);
    private static final Set<String> SUPPORTED_PLATFORMS = Set.of("android", "ios");

    private final ActorResolver actorResolver;
    private final PortalUserRepository portalUserRepository;
    private final FaceBiometricRepository faceBiometricRepository;
    private final FaceImageProcessor faceImageProcessor;

    public FaceBiometricService(
            ActorResolver actorResolver,
            PortalUserRepository portalUserRepository,
            FaceBiometricRepository faceBiometricRepository,
            FaceImageProcessor faceImageProcessor
    ) {
        this.actorResolver = actorResolver;
        this.portalUserRepository = portalUserRepository;
        this.faceBiometricRepository = faceBiometricRepository;
        this.faceImageProcessor = faceImageProcessor;
    }

    public FaceBiometricView enroll(Long userId, FacePayload payload, DeviceInfo device, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        ensureSelfOrSuperAdmin(actor, userId);
        String platform = normalizePlatform(device);
        FaceHashes hashes = faceImageProcessor.processAll(payload);

        PortalUser user = portalUserRepository.findById(userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        if (!user.isActive()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "USER_INACTIVE", "user is inactive");
        }

        int replaced = faceBiometricRepository.deactivateActiveForUser(userId);

        FaceBiometric biometric = new FaceBiometric();
        biometric.setUserId(userId);
        biometric.setFrontImageHash(hashes.front().sha256());
        biometric.setLeftImageHash(hashes.left().sha256());
        biometric.setRightImageHash(hashes.right().sha256());
        biometric.setFrontImageMimeType(hashes.front().mimeType());
        biometric.setLeftImageMimeType(hashes.left().mimeType());
        biometric.setRightImageMimeType(hashes.right().mimeType());
        biometric.setDevicePlatform(platform);
        biometric.setDeviceModel(device.model());
        biometric.setAppVersion(device.appVersion());
        biometric.setActive(true);
        FaceBiometric saved = faceBiometricRepository.save(biometric);

        log.info("Face biometric {} enrolled for user {} ({} previous record(s) deactivated)",
                saved.getId(), userId, replaced);
        return FaceBiometricView.from(saved);
    }

    @Transactional(readOnly = true)
    public Optional<FaceBiometricView> getActive(Long userId, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        ensureSelfOrSuperAdmin(actor, userId);
        return faceBiometricRepository.findFirstByUserIdAndActiveTrueOrderByIdDesc(userId)
                .map(FaceBiometricView::from);
    }

    public void delete(Long userId, Long actingUserId) {
        Actor actor = actorResolver.resolve(actingUserId);
        ensureSelfOrSuperAdmin(actor, userId);
        int deleted = faceBiometricRepository.deleteAllForUser(userId);
        if (deleted == 0) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "FACE_BIOMETRIC_NOT_FOUND");
        }
        log.info("Face biometric records of user {} deleted by user {}", userId, actor.userId());
    }

    private void ensureSelfOrSuperAdmin(Actor actor, Long userId) {
        if (userId == null) {
            throw ProblemException.invalid("USER_REQUIRED", "userId is required");
        }
        if (!actor.isSuperAdmin() && !userId.equals(actor.userId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "FACE_BIOMETRIC_FORBIDDEN");
        }
    }

    private static String normalizePlatform(DeviceInfo device) {
        if (device == null || device.platform() == null) {
            throw ProblemException.invalid("INVALID_DEVICE_PLATFORM", "device platform is required");
        }
        String platform = device.platform().trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_PLATFORMS.contains(platform)) {
            throw ProblemException.invalid("INVALID_DEVICE_PLATFORM", "device platform must be android or ios");
        }
        return platform;
    }

    public record DeviceInfo(String platform, String model, String appVersion) {
    }

    public record FaceBiometricView(
            Long id,
            Long userId,
            String devicePlatform,
            String deviceModel,
            String appVersion,
            boolean active,
            OffsetDateTime createdAt
    ) {

        static FaceBiometricView from(FaceBiometric biometric) {
            return new FaceBiometricView(
                    biometric.getId(),
                    biometric.getUserId(),
                    biometric.getDevicePlatform(),
                    biometric.getDeviceModel(),
                    biometric.getAppVersion(),
                    biometric.isActive(),
                    biometric.getCreatedAt()
            );
        }
    }
}
