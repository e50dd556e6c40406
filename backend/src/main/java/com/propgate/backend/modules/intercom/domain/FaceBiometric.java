package com.propgate.backend.modules.intercom.domain;

import com.propgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 얼굴 등록 정보. 원본 이미지는 저장하지 않고 정면/좌측/우측 이미지의 SHA-256 해시만 보관한다.
 */
@Entity
@Table(name = "face_biometric")
public class FaceBiometric extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "front_image_hash", nullable = false, length = 64)
    private String frontImageHash;

    @Column(name = "left_image_hash", nullable = false, length = 64)
    private String leftImageHash;

    @Column(name = "right_image_hash", nullable = false, length = 64)
    private String rightImageHash;

    @Column(name = "front_image_mime_type", nullable = false, length = 32)
    private String frontImageMimeType;

    @Column(name = "left_image_mime_type", nullable = false, length = 32)
    private String leftImageMimeType;

    @Column(name = "right_image_mime_type", nullable = false, length = 32)
    private String rightImageMimeType;

    @Column(name = "device_platform", nullable = false, length = 16)
    private String devicePlatform;

    @Column(name = "device_model", length = 100)
    private String deviceModel;

    @Column(name = "app_version", length = 32)
    private String appVersion;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public String getFrontImageHash() {
        return frontImageHash;
    }

    public void setFrontImageHash(String frontImageHash) {
        this.frontImageHash = frontImageHash;
    }

    public String getLeftImageHash() {
        return leftImageHash;
    }

    public void setLeftImageHash(String leftImageHash) {
        this.leftImageHash = leftImageHash;
    }

    public String getRightImageHash() {
        return rightImageHash;
    }

    public void setRightImageHash(String rightImageHash) {
        this.rightImageHash = rightImageHash;
    }

    public String getFrontImageMimeType() {
        return frontImageMimeType;
    }

    public void setFrontImageMimeType(String frontImageMimeType) {
        this.frontImageMimeType = frontImageMimeType;
    }

    public String getLeftImageMimeType() {
        return leftImageMimeType;
    }

    public void setLeftImageMimeType(String leftImageMimeType) {
        this.leftImageMimeType = leftImageMimeType;
    }

    public String getRightImageMimeType() {
        return rightImageMimeType;
    }

    public void setRightImageMimeType(String rightImageMimeType) {
        this.rightImageMimeType = rightImageMimeType;
    }

    public String getDevicePlatform() {
        return devicePlatform;
    }

    public void setDevicePlatform(String devicePlatform) {
        this.devicePlatform = devicePlatform;
    }

    public String getDeviceModel() {
        return deviceModel;
    }

    public void setDeviceModel(String deviceModel) {
        this.deviceModel = deviceModel;
    }

    public String getAppVersion() {
        return appVersion;
    }

    public void setAppVersion(String appVersion) {
        this.appVersion = appVersion;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
