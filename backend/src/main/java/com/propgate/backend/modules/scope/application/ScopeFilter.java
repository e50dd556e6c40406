package com.propgate.backend.modules.scope.application;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.modules.scope.domain.CreatorOwned;
import com.propgate.backend.modules.scope.domain.ResolvedScope;

import org.springframework.stereotype.Component;

/**
 * Applies a resolved scope to rows carrying a creator id.
 */
@Component
public class ScopeFilter {

    private final ScopeResolver scopeResolver;

    public ScopeFilter(ScopeResolver scopeResolver) {
        this.scopeResolver = scopeResolver;
    }

    public <T extends CreatorOwned> List<T> applyScope(Collection<T> rows, Long userId) {
        return applyScope(rows, userId, new ScopeResolutionContext());
    }

    public <T extends CreatorOwned> List<T> applyScope(Collection<T> rows, Long userId, ScopeResolutionContext context) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        ResolvedScope scope = scopeResolver.resolveScope(userId, context);
        return rows.stream()
                .filter(row -> row != null && scope.permits(row.getCreatedBy()))
                .toList();
    }

    public boolean hasAccess(CreatorOwned row, Long userId) {
        return hasAccess(row, userId, new ScopeResolutionContext());
    }

    public boolean hasAccess(CreatorOwned row, Long userId, ScopeResolutionContext context) {
        if (row == null) {
            return false;
        }
        return scopeResolver.resolveScope(userId, context).permits(row.getCreatedBy());
    }

    /**
     * Creator ids for a {@code created_by in (:ids)} predicate; empty means no predicate is needed.
     */
    public Optional<Set<Long>> creatorRestriction(Long userId, ScopeResolutionContext context) {
        return scopeResolver.resolveScope(userId, context).creatorRestriction();
    }
}
