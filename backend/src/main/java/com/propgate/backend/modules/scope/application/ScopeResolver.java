package com.propgate.backend.modules.scope.application;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.propgate.backend.modules.auth.domain.DataAccessControl;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.propgate.backend.modules.scope.domain.ResolvedScope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Resolves which rows a user may see from their user type's data-access flag.
 *
 * <p>For the PM flag the user's organization root is located by walking the invitation
 * chain ({@code invitedByUserId}, falling back to the legacy {@code createdByUserId}) until a
 * property-manager account is reached. The walk is iterative and tracks visited ids, so a
 * corrupted chain that loops back on itself ends the walk instead of recursing forever.
 */
@Component
public class ScopeResolver {

    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    private final PortalUserRepository portalUserRepository;

    public ScopeResolver(PortalUserRepository portalUserRepository) {
        this.portalUserRepository = portalUserRepository;
    }

    @Transactional(readOnly = true)
    public ResolvedScope resolveScope(Long userId) {
        return resolveScope(userId, new ScopeResolutionContext());
    }

    @Transactional(readOnly = true)
    public ResolvedScope resolveScope(Long userId, ScopeResolutionContext context) {
        Objects.requireNonNull(context, "context is required");
        if (userId == null) {
            return ResolvedScope.none(null);
        }
        Optional<ResolvedScope> cached = context.cachedScope(userId);
        if (cached.isPresent()) {
            return cached.get();
        }
        ResolvedScope resolved = computeScope(userId, context);
        context.remember(resolved);
        return resolved;
    }

    Optional<PortalUser> loadUser(Long userId, ScopeResolutionContext context) {
        return context.user(userId, portalUserRepository::findWithTypeById);
    }

    private ResolvedScope computeScope(Long userId, ScopeResolutionContext context) {
        Optional<PortalUser> user = loadUser(userId, context);
        if (user.isEmpty()) {
            log.debug("Scope requested for unknown user {}", userId);
            return ResolvedScope.none(userId);
        }
        DataAccessControl flag = user.get().getUserType() == null
                ? null
                : user.get().getUserType().getDataAccessControl();
        if (flag == null || flag == DataAccessControl.ALL) {
            return ResolvedScope.all(userId);
        }
        if (flag == DataAccessControl.OWN) {
            return ResolvedScope.own(userId);
        }
        return ResolvedScope.pm(userId, resolveEcosystem(user.get(), context));
    }

    private Set<Long> resolveEcosystem(PortalUser user, ScopeResolutionContext context) {
        Optional<Long> rootId = findPropertyManagerRoot(user, context);
        if (rootId.isEmpty()) {
            return Set.of(user.getId());
        }
        Set<Long> ecosystem = new LinkedHashSet<>();
        ecosystem.add(rootId.get());
        ecosystem.addAll(portalUserRepository.findEcosystemMemberIds(rootId.get()));
        return ecosystem;
    }

    private Optional<Long> findPropertyManagerRoot(PortalUser start, ScopeResolutionContext context) {
        Set<Long> visited = new HashSet<>();
        PortalUser current = start;
        while (current != null) {
            if (!visited.add(current.getId())) {
                log.warn("Invitation chain of user {} loops back to user {}", start.getId(), current.getId());
                return Optional.empty();
            }
            if (current.isPropertyManager()) {
                return Optional.of(current.getId());
            }
            Long parentId = current.getParentUserId();
            if (parentId == null) {
                return Optional.empty();
            }
            current = loadUser(parentId, context).orElse(null);
        }
        return Optional.empty();
    }
}
