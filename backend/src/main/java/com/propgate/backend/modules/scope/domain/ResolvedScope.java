package com.propgate.backend.modules.scope.domain;

import java.util.Optional;
import java.util.Set;

/**
 * Result of resolving a user's data-access scope. {@code ecosystemUserIds} is only
 * populated for {@link ScopeMode#PM}.
 */
public record ResolvedScope(Long userId, ScopeMode mode, Set<Long> ecosystemUserIds) {

    public ResolvedScope {
        ecosystemUserIds = ecosystemUserIds == null ? Set.of() : Set.copyOf(ecosystemUserIds);
    }

    public static ResolvedScope own(Long userId) {
        return new ResolvedScope(userId, ScopeMode.OWN, Set.of());
    }

    public static ResolvedScope all(Long userId) {
        return new ResolvedScope(userId, ScopeMode.ALL, Set.of());
    }

    public static ResolvedScope pm(Long userId, Set<Long> ecosystemUserIds) {
        return new ResolvedScope(userId, ScopeMode.PM, ecosystemUserIds);
    }

    public static ResolvedScope none(Long userId) {
        return new ResolvedScope(userId, ScopeMode.NONE, Set.of());
    }

    public boolean permits(Long createdBy) {
        return switch (mode) {
            case ALL -> true;
            case NONE -> false;
            case OWN -> createdBy != null && createdBy.equals(userId);
            case PM -> createdBy != null && ecosystemUserIds.contains(createdBy);
        };
    }

    /**
     * Creator ids a query must be restricted to, or empty when the scope is unrestricted.
     */
    public Optional<Set<Long>> creatorRestriction() {
        return switch (mode) {
            case ALL -> Optional.empty();
            case NONE -> Optional.of(Set.of());
            case OWN -> Optional.of(userId == null ? Set.of() : Set.of(userId));
            case PM -> Optional.of(ecosystemUserIds);
        };
    }
}
