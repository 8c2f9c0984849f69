package com.alari.companion.security;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single authorization point for conversations and goals. A resource that does not exist
 * and one that belongs to another user produce the same {@link AccessDecision#notFound()}.
 */
@Component
public class OwnershipGuard {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    public <T extends OwnedResource> AccessDecision<T> authorize(Identity identity, Optional<T> resource) {
        if (identity == null || identity.id() == null || resource.isEmpty()) {
            return AccessDecision.notFound();
        }
        T candidate = resource.get();
        if (!Objects.equals(candidate.getUserId(), identity.id())) {
            log.debug("Ownership check denied user {} access to {}", identity.id(), candidate.getClass().getSimpleName());
            return AccessDecision.notFound();
        }
        return AccessDecision.allowed(candidate);
    }
}
