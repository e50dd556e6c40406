package com.propgate.backend.modules.intercom.domain;

public record AccessContext(String ipAddress, String deviceInfo) {

    public static AccessContext empty() {
        return new AccessContext(null, null);
    }
}
