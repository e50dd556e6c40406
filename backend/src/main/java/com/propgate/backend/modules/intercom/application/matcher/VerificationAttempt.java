package com.propgate.backend.modules.intercom.application.matcher;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;

import com.propgate.backend.modules.intercom.domain.FacePayload;
import com.propgate.backend.modules.property.domain.AccessPoint;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

/**
 * Inputs shared by every matcher for a single verification call.
 */
public record VerificationAttempt(
        AccessPoint accessPoint,
        String pin,
        FacePayload face,
        OffsetDateTime now,
        ScopeResolutionContext scopeContext
) {

    /**
     * BCrypt only reads the first 72 bytes of its input, so no stored secret is longer than this.
     */
    public static final int MAX_SECRET_BYTES = 72;

    /**
     * A pin longer than any storable secret is treated as absent; otherwise it could match a
     * stored secret that is a 72 byte prefix of it.
     */
    public boolean hasPin() {
        return pin != null
                && !pin.isBlank()
                && pin.getBytes(StandardCharsets.UTF_8).length <= MAX_SECRET_BYTES;
    }

    public boolean hasFace() {
        return face != null;
    }
}
