package com.propgate.backend.modules.intercom.infrastructure.persistence;

import java.util.List;

/**
 * Id list arguments for the {@code search} queries.
 */
public final class IdFilters {

    /**
     * Passed when the query's restriction flag is false. The flag short-circuits the IN clause,
     * so the value is never compared; it only keeps the bound list non-empty.
     */
    public static final List<Long> UNRESTRICTED = List.of(-1L);

    private IdFilters() {
    }
}
