package com.propgate.backend.modules.intercom.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.propgate.backend.modules.intercom.application.AccessAuditLogger.AccessLogCommand;
import com.propgate.backend.modules.intercom.application.matcher.MatchOutcome;
import com.propgate.backend.modules.intercom.domain.AccessDecision;
import com.propgate.backend.modules.intercom.domain.CredentialType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Entry point for intercom unlock requests.
 *
 * <p>Verification fails closed: when storage is unavailable the caller gets a denial, never an
 * exception it might misread, and a failure row is attempted in a separate transaction.
 */
@Service
public class AccessVerificationService {

    static final String REASON_STORAGE_FAILURE = "Verification unavailable";

    private static final Logger log = LoggerFactory.getLogger(AccessVerificationService.class);

    private final CredentialVerifier credentialVerifier;
    private final AccessAuditLogger accessAuditLogger;
    private final Clock clock;

    public AccessVerificationService(
            CredentialVerifier credentialVerifier,
            AccessAuditLogger accessAuditLogger,
            Clock clock
    ) {
        this.credentialVerifier = credentialVerifier;
        this.accessAuditLogger = accessAuditLogger;
        this.clock = clock;
    }

    public AccessDecision verifyAccess(VerifyAccessCommand command) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            return credentialVerifier.verify(command, now);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Access verification failed at access point {}, denying", command.accessPointId(), ex);
            recordStorageFailure(command, now);
            return new AccessDecision(
                    false,
                    MatchOutcome.REASON_INVALID_OR_EXPIRED,
                    CredentialType.NONE,
                    null,
                    null,
                    now
            );
        }
    }

    private void recordStorageFailure(VerifyAccessCommand command, OffsetDateTime now) {
        try {
            accessAuditLogger.recordIsolated(new AccessLogCommand(
                    command.accessPointId(),
                    null,
                    CredentialType.NONE,
                    null,
                    false,
                    REASON_STORAGE_FAILURE,
                    command.context().ipAddress(),
                    command.context().deviceInfo(),
                    now
            ));
        } catch (RuntimeException ex) {
            log.warn("Could not record failed verification for access point {}", command.accessPointId(), ex);
        }
    }
}
