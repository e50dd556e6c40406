package com.propgate.backend.modules.intercom.domain;

import java.time.OffsetDateTime;

import com.propgate.backend.global.jpa.AbstractTimestampedEntity;
import com.propgate.backend.modules.scope.domain.CreatorOwned;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 사용 횟수 제한이 있는 임시 PIN (레거시 경로). 최대 사용 횟수에 도달하면 비활성화된다.
 */
@Entity
@Table(name = "temporary_pin")
public class TemporaryPin extends AbstractTimestampedEntity implements CreatorOwned {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "access_point_id", nullable = false)
    private Long accessPointId;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    @Column(name = "pin_hash", nullable = false, length = 100)
    private String pinHash;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "max_uses", nullable = false)
    private int maxUses = 1;

    @Column(name = "uses_count", nullable = false)
    private int usesCount;

    @Column(name = "first_used_at")
    private OffsetDateTime firstUsedAt;

    @Column(name = "last_used_at")
    private OffsetDateTime lastUsedAt;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public Long getId() {
        return id;
    }

    public Long getAccessPointId() {
        return accessPointId;
    }

    public void setAccessPointId(Long accessPointId) {
        this.accessPointId = accessPointId;
    }

    @Override
    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public String getPinHash() {
        return pinHash;
    }

    public void setPinHash(String pinHash) {
        this.pinHash = pinHash;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public int getMaxUses() {
        return maxUses;
    }

    public void setMaxUses(int maxUses) {
        this.maxUses = maxUses;
    }

    public int getUsesCount() {
        return usesCount;
    }

    public OffsetDateTime getFirstUsedAt() {
        return firstUsedAt;
    }

    public OffsetDateTime getLastUsedAt() {
        return lastUsedAt;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isUsableAt(OffsetDateTime now) {
        return active && usesCount < maxUses && expiresAt != null && expiresAt.isAfter(now);
    }

    /**
     * 사용 1회를 기록하고, 최대 횟수에 도달하면 비활성화한다.
     */
    public void registerUse(OffsetDateTime now) {
        if (!isUsableAt(now)) {
            throw new IllegalStateException("temporary pin " + id + " is no longer usable");
        }
        usesCount++;
        if (firstUsedAt == null) {
            firstUsedAt = now;
        }
        lastUsedAt = now;
        if (usesCount >= maxUses) {
            active = false;
        }
    }
}
