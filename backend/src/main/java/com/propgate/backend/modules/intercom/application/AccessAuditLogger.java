package com.propgate.backend.modules.intercom.application;

import java.time.OffsetDateTime;
import java.util.Objects;

import com.propgate.backend.modules.intercom.domain.AccessLog;
import com.propgate.backend.modules.intercom.domain.CredentialType;
import com.propgate.backend.modules.intercom.infrastructure.persistence.AccessLogRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only writer for {@link AccessLog}. Rows are never updated or deleted.
 */
@Component
public class AccessAuditLogger {

    private final AccessLogRepository accessLogRepository;

    public AccessAuditLogger(AccessLogRepository accessLogRepository) {
        this.accessLogRepository = accessLogRepository;
    }

    /**
     * Writes in the caller's transaction, so the row commits or rolls back with the state change it records.
     */
    @Transactional
    public AccessLog record(AccessLogCommand command) {
        return accessLogRepository.save(toEntity(command));
    }

    /**
     * Writes in its own transaction. Used after the verification transaction has already failed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AccessLog recordIsolated(AccessLogCommand command) {
        return accessLogRepository.save(toEntity(command));
    }

    private AccessLog toEntity(AccessLogCommand command) {
        Objects.requireNonNull(command.accessPointId(), "accessPointId is required");
        Objects.requireNonNull(command.credentialType(), "credentialType is required");
        Objects.requireNonNull(command.occurredAt(), "occurredAt is required");
        return new AccessLog(
                command.accessPointId(),
                command.userId(),
                command.credentialType(),
                command.credentialRefId(),
                command.success(),
                truncate(command.reason(), 200),
                truncate(command.ipAddress(), 64),
                truncate(command.deviceInfo(), 255),
                command.occurredAt()
        );
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    public record AccessLogCommand(
            Long accessPointId,
            Long userId,
            CredentialType credentialType,
            Long credentialRefId,
            boolean success,
            String reason,
            String ipAddress,
            String deviceInfo,
            OffsetDateTime occurredAt
    ) {
    }
}
