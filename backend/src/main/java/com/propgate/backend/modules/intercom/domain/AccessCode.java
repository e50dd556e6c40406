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
 * 방문자용 출입 코드. access_point_id 가 비어 있으면 건물 전체 인터폰에서 유효하다.
 * code_plain 은 관리 화면 표시용 사본이며 검증에는 code_hash 만 사용한다.
 */
@Entity
@Table(name = "access_code")
public class AccessCode extends AbstractTimestampedEntity implements CreatorOwned {

    public static final String CODE_TYPE_PIN = "PIN";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "building_id", nullable = false)
    private Long buildingId;

    @Column(name = "access_point_id")
    private Long accessPointId;

    @Column(name = "tenant_user_id")
    private Long tenantUserId;

    @Column(name = "code_type", nullable = false, length = 16)
    private String codeType = CODE_TYPE_PIN;

    @Column(name = "code_hash", nullable = false, length = 100)
    private String codeHash;

    @Column(name = "code_plain", length = 200)
    private String codePlain;

    @Column(name = "valid_from")
    private OffsetDateTime validFrom;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "single_use", nullable = false)
    private boolean singleUse;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "consumed_at")
    private OffsetDateTime consumedAt;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    public Long getId() {
        return id;
    }

    public Long getBuildingId() {
        return buildingId;
    }

    public void setBuildingId(Long buildingId) {
        this.buildingId = buildingId;
    }

    public Long getAccessPointId() {
        return accessPointId;
    }

    public void setAccessPointId(Long accessPointId) {
        this.accessPointId = accessPointId;
    }

    public Long getTenantUserId() {
        return tenantUserId;
    }

    public void setTenantUserId(Long tenantUserId) {
        this.tenantUserId = tenantUserId;
    }

    public String getCodeType() {
        return codeType;
    }

    public void setCodeType(String codeType) {
        this.codeType = codeType;
    }

    public String getCodeHash() {
        return codeHash;
    }

    public void setCodeHash(String codeHash) {
        this.codeHash = codeHash;
    }

    public String getCodePlain() {
        return codePlain;
    }

    public void setCodePlain(String codePlain) {
        this.codePlain = codePlain;
    }

    public OffsetDateTime getValidFrom() {
        return validFrom;
    }

    public void setValidFrom(OffsetDateTime validFrom) {
        this.validFrom = validFrom;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public boolean isSingleUse() {
        return singleUse;
    }

    public void setSingleUse(boolean singleUse) {
        this.singleUse = singleUse;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getConsumedAt() {
        return consumedAt;
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    /**
     * 1회용 코드 사용 처리. 사용된 코드는 다시 활성화할 수 없다.
     */
    public void markConsumed(OffsetDateTime now) {
        this.consumedAt = now;
        this.active = false;
    }

    @Override
    public Long getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(Long createdBy) {
        this.createdBy = createdBy;
    }

    public boolean isValidAt(OffsetDateTime now) {
        if (!active) {
            return false;
        }
        if (validFrom != null && validFrom.isAfter(now)) {
            return false;
        }
        return expiresAt == null || expiresAt.isAfter(now);
    }

    public boolean appliesTo(Long targetAccessPointId, Long targetBuildingId) {
        if (accessPointId != null) {
            return accessPointId.equals(targetAccessPointId);
        }
        return buildingId != null && buildingId.equals(targetBuildingId);
    }
}
