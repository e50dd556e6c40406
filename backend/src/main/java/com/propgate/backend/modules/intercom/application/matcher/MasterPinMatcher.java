package com.propgate.backend.modules.intercom.application.matcher;

import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.domain.MasterPin;
import com.propgate.backend.modules.intercom.infrastructure.persistence.MasterPinRepository;

import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class MasterPinMatcher implements CredentialMatcher {

    private final MasterPinRepository masterPinRepository;
    private final PasswordEncoder passwordEncoder;

    public MasterPinMatcher(MasterPinRepository masterPinRepository, PasswordEncoder passwordEncoder) {
        this.masterPinRepository = masterPinRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public CredentialType credentialType() {
        return CredentialType.MASTER;
    }

    @Override
    public boolean supports(VerificationAttempt attempt) {
        return attempt.hasPin();
    }

    @Override
    public Optional<MatchOutcome> attempt(VerificationAttempt attempt) {
        return masterPinRepository.findFirstByAccessPointIdAndActiveTrueOrderByIdDesc(attempt.accessPoint().getId())
                .filter(master -> passwordEncoder.matches(attempt.pin(), master.getPinHash()))
                .map(MasterPin::getId)
                .map(masterId -> MatchOutcome.granted(CredentialType.MASTER, masterId, null));
    }
}
