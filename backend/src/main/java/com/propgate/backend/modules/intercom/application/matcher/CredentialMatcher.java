package com.propgate.backend.modules.intercom.application.matcher;

import java.util.Optional;

import com.propgate.backend.modules.intercom.domain.CredentialType;

/**
 * One credential variant in the verification chain.
 *
 * <p>{@link #attempt} returns empty when the input does not match this variant, letting the
 * next matcher run. A present outcome ends the chain, whether it grants or denies.
 */
public interface CredentialMatcher {

    CredentialType credentialType();

    boolean supports(VerificationAttempt attempt);

    Optional<MatchOutcome> attempt(VerificationAttempt attempt);
}
