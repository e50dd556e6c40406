package com.propgate.backend.modules.intercom.domain;

import java.time.OffsetDateTime;

/**
 * Outcome of one verification attempt as returned to the access point.
 */
public record AccessDecision(
        boolean granted,
        String reason,
        CredentialType credentialType,
        Long credentialRefId,
        Long userId,
        OffsetDateTime timestamp
) {
}
