package com.propgate.backend.modules.intercom.application.matcher;

import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.domain.TemporaryPin;
import com.propgate.backend.modules.intercom.infrastructure.persistence.CredentialHashView;
import com.propgate.backend.modules.intercom.infrastructure.persistence.TemporaryPinRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * 레거시 임시 PIN. 사용할 때마다 횟수를 올리고 최대 횟수에 도달하면 비활성화한다.
 */
@Component
@Order(20)
public class TemporaryPinMatcher implements CredentialMatcher {

    private static final Logger log = LoggerFactory.getLogger(TemporaryPinMatcher.class);

    private final TemporaryPinRepository temporaryPinRepository;
    private final PasswordEncoder passwordEncoder;

    public TemporaryPinMatcher(TemporaryPinRepository temporaryPinRepository, PasswordEncoder passwordEncoder) {
        this.temporaryPinRepository = temporaryPinRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public CredentialType credentialType() {
        return CredentialType.TEMPORARY_PIN;
    }

    @Override
    public boolean supports(VerificationAttempt attempt) {
        return attempt.hasPin();
    }

    @Override
    public Optional<MatchOutcome> attempt(VerificationAttempt attempt) {
        for (CredentialHashView candidate : temporaryPinRepository.findUsableCandidates(
                attempt.accessPoint().getId(), attempt.now())) {
            if (!passwordEncoder.matches(attempt.pin(), candidate.getHash())) {
                continue;
            }
            Optional<TemporaryPin> locked = temporaryPinRepository.findByIdForUpdate(candidate.getId());
            if (locked.isEmpty() || !locked.get().isUsableAt(attempt.now())) {
                log.debug("Temporary pin {} ran out of uses before it could be locked", candidate.getId());
                continue;
            }
            TemporaryPin pin = locked.get();
            pin.registerUse(attempt.now());
            return Optional.of(MatchOutcome.granted(CredentialType.TEMPORARY_PIN, pin.getId(), pin.getCreatedBy()));
        }
        return Optional.empty();
    }
}
