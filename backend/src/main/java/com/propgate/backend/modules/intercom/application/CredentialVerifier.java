package com.propgate.backend.modules.intercom.application;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import com.propgate.backend.modules.intercom.application.AccessAuditLogger.AccessLogCommand;
import com.propgate.backend.modules.intercom.application.matcher.CredentialMatcher;
import com.propgate.backend.modules.intercom.application.matcher.MatchOutcome;
import com.propgate.backend.modules.intercom.application.matcher.VerificationAttempt;
import com.propgate.backend.modules.intercom.domain.AccessDecision;
import com.propgate.backend.modules.property.domain.AccessPoint;
import com.propgate.backend.modules.property.infrastructure.persistence.AccessPointRepository;
import com.propgate.backend.modules.scope.application.ScopeResolutionContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Runs the ordered matcher chain and records the outcome, all in one transaction: a consumed
 * single-use credential and its access-log row commit together or not at all.
 */
@Component
public class CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(CredentialVerifier.class);

    private final AccessPointRepository accessPointRepository;
    private final List<CredentialMatcher> matchers;
    private final AccessAuditLogger accessAuditLogger;

    public CredentialVerifier(
            AccessPointRepository accessPointRepository,
            List<CredentialMatcher> matchers,
            AccessAuditLogger accessAuditLogger
    ) {
        this.accessPointRepository = accessPointRepository;
        this.matchers = List.copyOf(matchers);
        this.accessAuditLogger = accessAuditLogger;
    }

    @Transactional
    public AccessDecision verify(VerifyAccessCommand command, OffsetDateTime now) {
        if (command.accessPointId() == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND");
        }
        AccessPoint accessPoint = accessPointRepository.findById(command.accessPointId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "ACCESS_POINT_NOT_FOUND"));

        VerificationAttempt attempt = new VerificationAttempt(
                accessPoint,
                command.pin(),
                command.face(),
                now,
                new ScopeResolutionContext()
        );
        MatchOutcome outcome = dispatch(attempt);

        accessAuditLogger.record(new AccessLogCommand(
                accessPoint.getId(),
                outcome.userId(),
                outcome.credentialType(),
                outcome.credentialRefId(),
                outcome.granted(),
                outcome.reason(),
                command.context().ipAddress(),
                command.context().deviceInfo(),
                now
        ));

        if (outcome.granted()) {
            log.info("Access granted at access point {} via {} (ref={})",
                    accessPoint.getId(), outcome.credentialType().getLabel(), outcome.credentialRefId());
        } else {
            log.info("Access denied at access point {}: {}", accessPoint.getId(), outcome.reason());
        }
        return new AccessDecision(
                outcome.granted(),
                outcome.reason(),
                outcome.credentialType(),
                outcome.credentialRefId(),
                outcome.userId(),
                now
        );
    }

    private MatchOutcome dispatch(VerificationAttempt attempt) {
        for (CredentialMatcher matcher : matchers) {
            if (!matcher.supports(attempt)) {
                continue;
            }
            Optional<MatchOutcome> outcome = matcher.attempt(attempt);
            if (outcome.isPresent()) {
                return outcome.get();
            }
            log.debug("No {} credential matched at access point {}",
                    matcher.credentialType().getLabel(), attempt.accessPoint().getId());
        }
        return MatchOutcome.noMatch();
    }
}
