package com.propgate.backend.modules.intercom.application.matcher;

import com.propgate.backend.modules.intercom.domain.CredentialType;

public record MatchOutcome(
        boolean granted,
        CredentialType credentialType,
        Long credentialRefId,
        Long userId,
        String reason
) {

    public static final String REASON_GRANTED = "OK";
    public static final String REASON_INVALID_OR_EXPIRED = "Invalid or expired";

    public static MatchOutcome granted(CredentialType type, Long credentialRefId, Long userId) {
        return new MatchOutcome(true, type, credentialRefId, userId, REASON_GRANTED);
    }

    public static MatchOutcome denied(CredentialType type, Long credentialRefId, Long userId, String reason) {
        return new MatchOutcome(false, type, credentialRefId, userId, reason);
    }

    public static MatchOutcome noMatch() {
        return new MatchOutcome(false, CredentialType.NONE, null, null, REASON_INVALID_OR_EXPIRED);
    }
}
