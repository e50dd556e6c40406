package com.propgate.backend.modules.auth.domain;

import java.util.Locale;

/**
 * 사용자 유형별 데이터 접근 범위 플래그.
 */
public enum DataAccessControl {
    OWN("OWN"),
    ALL("ALL"),
    PM("PM");

    private final String code;

    DataAccessControl(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses the stored flag. {@code PM-ECOSYSTEM} is the legacy spelling of {@link #PM};
     * blank values return {@code null}, which callers treat as {@link #ALL}.
     */
    public static DataAccessControl fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "OWN" -> OWN;
            case "ALL" -> ALL;
            case "PM", "PM-ECOSYSTEM", "PM_ECOSYSTEM" -> PM;
            default -> throw new IllegalArgumentException("Unknown data access control: " + value);
        };
    }
}
