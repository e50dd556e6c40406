package com.propgate.backend.modules.auth.application;

import com.propgate.backend.modules.auth.domain.ActorRole;
import com.propgate.backend.modules.auth.domain.PortalUser;
import com.propgate.backend.modules.auth.infrastructure.persistence.PortalUserRepository;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Resolves who is performing a management operation and in which role.
 * Roles derive from the user's type; there is no separate grant table.
 */
@Component
public class ActorResolver {

    private final PortalUserRepository portalUserRepository;

    public ActorResolver(PortalUserRepository portalUserRepository) {
        this.portalUserRepository = portalUserRepository;
    }

    @Transactional(readOnly = true)
    public Actor resolve(Long actingUserId) {
        if (actingUserId == null) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ACTOR_REQUIRED");
        }
        PortalUser user = portalUserRepository.findWithTypeById(actingUserId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.FORBIDDEN, "UNKNOWN_ACTOR"));
        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "ACTOR_INACTIVE");
        }
        return new Actor(user.getId(), ActorRole.of(user.getUserType()));
    }

    public record Actor(Long userId, ActorRole role) {

        public boolean isSuperAdmin() {
            return role == ActorRole.SUPER_ADMIN;
        }

        public boolean isTenant() {
            return role == ActorRole.TENANT;
        }
    }
}
