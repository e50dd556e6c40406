package com.propgate.backend.modules.scope.application;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.scope.domain.ResolvedScope;

/**
 * Memoizes scope lookups for one logical operation. Create one per request or service call,
 * pass it down the call chain and drop it afterwards; instances are not thread-safe and
 * must never be shared between callers.
 */
public final class ScopeResolutionContext {

    private final Map<Long, ResolvedScope> scopes = new HashMap<>();
    private final Map<Long, Optional<PortalUser>> users = new HashMap<>();

    public Optional<ResolvedScope> cachedScope(Long userId) {
        return Optional.ofNullable(scopes.get(userId));
    }

    void remember(ResolvedScope scope) {
        scopes.put(scope.userId(), scope);
    }

    Optional<PortalUser> user(Long userId, Function<Long, Optional<PortalUser>> loader) {
        Optional<PortalUser> cached = users.get(userId);
        if (cached != null) {
            return cached;
        }
        Optional<PortalUser> loaded = loader.apply(userId);
        users.put(userId, loaded);
        return loaded;
    }
}
