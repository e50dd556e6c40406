package com.propgate.backend.modules.intercom.application.matcher;

import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.domain.UserPin;
import com.propgate.backend.modules.intercom.infrastructure.persistence.UserPinRepository;

import org.springframework.core.annotation.Order;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Personal pins of active users. Runs after the master pin so the administrative override wins
 * when both hashes happen to match.
 */
@Component
@Order(40)
public class UserPinMatcher implements CredentialMatcher {

    private final UserPinRepository userPinRepository;
    private final PasswordEncoder passwordEncoder;

    public UserPinMatcher(UserPinRepository userPinRepository, PasswordEncoder passwordEncoder) {
        this.userPinRepository = userPinRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public CredentialType credentialType() {
        return CredentialType.USER;
    }

    @Override
    public boolean supports(VerificationAttempt attempt) {
        return attempt.hasPin();
    }

    @Override
    public Optional<MatchOutcome> attempt(VerificationAttempt attempt) {
        for (UserPin userPin : userPinRepository.findActiveForAccessPoint(attempt.accessPoint().getId())) {
            if (passwordEncoder.matches(attempt.pin(), userPin.getPinHash())) {
                return Optional.of(MatchOutcome.granted(CredentialType.USER, userPin.getId(), userPin.getUserId()));
            }
        }
        return Optional.empty();
    }
}
