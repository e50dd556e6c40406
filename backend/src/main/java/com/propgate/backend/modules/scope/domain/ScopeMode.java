package com.propgate.backend.modules.scope.domain;

public enum ScopeMode {
    /** Only rows the user created. */
    OWN,
    /** No filtering. */
    ALL,
    /** Rows created by anyone in the user's property-manager ecosystem. */
    PM,
    /** Unknown user: nothing is visible. */
    NONE
}
