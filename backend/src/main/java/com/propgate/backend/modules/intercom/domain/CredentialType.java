package com.propgate.backend.modules.intercom.domain;

/**
 * Credential kind recorded on each access-log row.
 */
public enum CredentialType {
    ACCESS_CODE("AccessCode"),
    TEMPORARY_PIN("TemporaryPin"),
    MASTER("Master"),
    USER("User"),
    FACE("Face"),
    NONE("None");

    private final String label;

    CredentialType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
