package com.propgate.backend.modules.auth.domain;

public enum ActorRole {
    SUPER_ADMIN,
    PROPERTY_MANAGER,
    FRONT_DESK,
    TENANT,
    OTHER;

    public static ActorRole of(UserType userType) {
        if (userType == null || userType.getCode() == null) {
            return OTHER;
        }
        if (userType.hasCode(UserType.SUPER_ADMIN)) {
            return SUPER_ADMIN;
        }
        if (userType.hasCode(UserType.PROPERTY_MANAGER)) {
            return PROPERTY_MANAGER;
        }
        if (userType.hasCode(UserType.FRONT_DESK)) {
            return FRONT_DESK;
        }
        if (userType.hasCode(UserType.TENANT)) {
            return TENANT;
        }
        return OTHER;
    }
}
