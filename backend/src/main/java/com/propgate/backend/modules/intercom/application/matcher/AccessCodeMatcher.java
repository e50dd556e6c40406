package com.propgate.backend.modules.intercom.application.matcher;

import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.AccessCode;
import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.infrastructure.persistence.AccessCodeRepository;
import com.propgate.backend.modules.intercom.infrastructure.persistence.CredentialHashView;
import com.propgate.backend.modules.property.domain.AccessPoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Visitor access codes, checked first. A single-use code is deactivated under a row lock in
 * the caller's transaction, so concurrent attempts with the same code grant at most once.
 */
@Component
@Order(10)
public class AccessCodeMatcher implements CredentialMatcher {

    private static final Logger log = LoggerFactory.getLogger(AccessCodeMatcher.class);

    private final AccessCodeRepository accessCodeRepository;
    private final PasswordEncoder passwordEncoder;

    public AccessCodeMatcher(AccessCodeRepository accessCodeRepository, PasswordEncoder passwordEncoder) {
        this.accessCodeRepository = accessCodeRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public CredentialType credentialType() {
        return CredentialType.ACCESS_CODE;
    }

    @Override
    public boolean supports(VerificationAttempt attempt) {
        return attempt.hasPin();
    }

    @Override
    public Optional<MatchOutcome> attempt(VerificationAttempt attempt) {
        AccessPoint accessPoint = attempt.accessPoint();
        List<CredentialHashView> candidates = accessCodeRepository.findValidCandidates(
                accessPoint.getId(),
                accessPoint.getBuildingId(),
                attempt.now()
        );
        for (CredentialHashView candidate : candidates) {
            if (!passwordEncoder.matches(attempt.pin(), candidate.getHash())) {
                continue;
            }
            Optional<AccessCode> locked = accessCodeRepository.findByIdForUpdate(candidate.getId());
            if (locked.isEmpty()
                    || !locked.get().isValidAt(attempt.now())
                    || !locked.get().appliesTo(accessPoint.getId(), accessPoint.getBuildingId())) {
                log.debug("Access code {} was consumed or changed before it could be locked", candidate.getId());
                continue;
            }
            AccessCode code = locked.get();
            if (code.isSingleUse()) {
                code.markConsumed(attempt.now());
            }
            return Optional.of(MatchOutcome.granted(CredentialType.ACCESS_CODE, code.getId(), code.getCreatedBy()));
        }
        return Optional.empty();
    }
}
