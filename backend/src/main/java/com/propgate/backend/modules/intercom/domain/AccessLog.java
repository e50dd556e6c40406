package com.propgate.backend.modules.intercom.domain;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;

/**
 * 인터폰 출입 시도 감사 로그. 한 번 기록되면 수정/삭제하지 않는다.
 */
@Entity
@Immutable
@Table(name = "access_log")
public class AccessLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "access_point_id", nullable = false, updatable = false)
    private Long accessPointId;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "credential_type", nullable = false, updatable = false, length = 16)
    private CredentialType credentialType;

    @Column(name = "credential_ref_id", updatable = false)
    private Long credentialRefId;

    @Column(name = "success", nullable = false, updatable = false)
    private boolean success;

    @Column(name = "reason", length = 200, updatable = false)
    private String reason;

    @Column(name = "ip_address", length = 64, updatable = false)
    private String ipAddress;

    @Column(name = "device_info", length = 255, updatable = false)
    private String deviceInfo;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private OffsetDateTime occurredAt;

    protected AccessLog() {
    }

    public AccessLog(
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
        this.accessPointId = accessPointId;
        this.userId = userId;
        this.credentialType = credentialType;
        this.credentialRefId = credentialRefId;
        this.success = success;
        this.reason = reason;
        this.ipAddress = ipAddress;
        this.deviceInfo = deviceInfo;
        this.occurredAt = occurredAt;
    }

    public Long getId() {
        return id;
    }

    public Long getAccessPointId() {
        return accessPointId;
    }

    public Long getUserId() {
        return userId;
    }

    public CredentialType getCredentialType() {
        return credentialType;
    }

    public Long getCredentialRefId() {
        return credentialRefId;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getReason() {
        return reason;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getDeviceInfo() {
        return deviceInfo;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }
}
