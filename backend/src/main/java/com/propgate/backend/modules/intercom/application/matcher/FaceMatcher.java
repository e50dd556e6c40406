package com.propgate.backend.modules.intercom.application.matcher;

import java.util.List;
import java.util.Optional;

import com.propgate.backend.global.error.ProblemException;
import com.propgate.backend.modules.intercom.application.FaceImageProcessor;
import com.propgate.backend.modules.intercom.application.FaceImageProcessor.FaceHashes;
import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.domain.FaceBiometric;
import com.propgate.backend.modules.intercom.infrastructure.persistence.FaceBiometricRepository;
import com.propgate.backend.modules.scope.application.BuildingAccessPolicy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Face path, reached only when no pin based credential granted.
 *
 * <p>Matching compares SHA-256 content hashes of the three submitted images with enrolled
 * hashes, so only a byte-identical capture matches. A real similarity matcher would replace
 * {@link FaceImageProcessor} hashing and the repository lookup.
 */
@Component
@Order(50)
public class FaceMatcher implements CredentialMatcher {

    public static final String REASON_INVALID_PAYLOAD = "Invalid face payload";
    public static final String REASON_NO_BUILDING_ACCESS = "User has no access to this building";

    private static final Logger log = LoggerFactory.getLogger(FaceMatcher.class);

    private final FaceImageProcessor faceImageProcessor;
    private final FaceBiometricRepository faceBiometricRepository;
    private final BuildingAccessPolicy buildingAccessPolicy;

    public FaceMatcher(
            FaceImageProcessor faceImageProcessor,
            FaceBiometricRepository faceBiometricRepository,
            BuildingAccessPolicy buildingAccessPolicy
    ) {
        this.faceImageProcessor = faceImageProcessor;
        this.faceBiometricRepository = faceBiometricRepository;
        this.buildingAccessPolicy = buildingAccessPolicy;
    }

    @Override
    public CredentialType credentialType() {
        return CredentialType.FACE;
    }

    @Override
    public boolean supports(VerificationAttempt attempt) {
        return attempt.hasFace();
    }

    @Override
    public Optional<MatchOutcome> attempt(VerificationAttempt attempt) {
        FaceHashes hashes;
        try {
            hashes = faceImageProcessor.processAll(attempt.face());
        } catch (ProblemException ex) {
            log.debug("Rejected face payload at access point {}: {}", attempt.accessPoint().getId(), ex.getDetailMessage());
            return Optional.of(MatchOutcome.denied(CredentialType.FACE, null, null, REASON_INVALID_PAYLOAD));
        }

        List<FaceBiometric> matches = faceBiometricRepository.findActiveByHashes(
                hashes.front().sha256(),
                hashes.left().sha256(),
                hashes.right().sha256()
        );
        if (matches.isEmpty()) {
            return Optional.empty();
        }

        FaceBiometric match = matches.get(0);
        boolean allowed = buildingAccessPolicy.hasBuildingAccess(
                match.getUserId(),
                attempt.accessPoint().getBuildingId(),
                attempt.scopeContext()
        );
        if (!allowed) {
            return Optional.of(MatchOutcome.denied(
                    CredentialType.FACE, match.getId(), match.getUserId(), REASON_NO_BUILDING_ACCESS));
        }
        return Optional.of(MatchOutcome.granted(CredentialType.FACE, match.getId(), match.getUserId()));
    }
}
