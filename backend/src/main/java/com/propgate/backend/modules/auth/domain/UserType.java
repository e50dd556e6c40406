package com.propgate.backend.modules.auth.domain;

import com.propgate.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 사용자 유형. code 로 역할을 판별하고 dataAccessControl 로 조회 범위를 결정한다.
 */
@Entity
@Table(name = "user_type")
public class UserType extends AbstractTimestampedEntity {

    public static final String SUPER_ADMIN = "SUPER_ADMIN";
    public static final String PROPERTY_MANAGER = "PROPERTY_MANAGER";
    public static final String FRONT_DESK = "FRONT_DESK";
    public static final String TENANT = "TENANT";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "code", nullable = false, unique = true, length = 32)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Convert(converter = DataAccessControlConverter.class)
    @Column(name = "data_access_control", length = 16)
    private DataAccessControl dataAccessControl;

    public Long getId() {
        return id;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DataAccessControl getDataAccessControl() {
        return dataAccessControl;
    }

    public void setDataAccessControl(DataAccessControl dataAccessControl) {
        this.dataAccessControl = dataAccessControl;
    }

    public boolean hasCode(String expected) {
        return code != null && code.equalsIgnoreCase(expected);
    }
}
