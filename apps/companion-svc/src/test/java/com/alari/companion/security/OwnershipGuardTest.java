package com.alari.companion.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class OwnershipGuardTest {

    private final OwnershipGuard guard = new OwnershipGuard();
    private final Identity alice = new Identity(1L, "alice@example.com", "Alice");

    private record Owned(Long getUserId) implements OwnedResource {}

    @Test
    void ownerIsAllowed() {
        Owned resource = new Owned(1L);

        AccessDecision<Owned> decision = guard.authorize(alice, Optional.of(resource));

        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.orElseThrow(ResourceNotFoundException::conversation)).isSameAs(resource);
    }

    @Test
    void missingAndForeignResourcesAreIndistinguishable() {
        AccessDecision<Owned> missing = guard.authorize(alice, Optional.empty());
        AccessDecision<Owned> foreign = guard.authorize(alice, Optional.of(new Owned(2L)));

        assertThat(missing.isAllowed()).isFalse();
        assertThat(foreign).isSameAs(missing);
        assertThatThrownBy(() -> foreign.orElseThrow(ResourceNotFoundException::conversation))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Conversation not found");
    }

    @Test
    void anonymousCallerIsNeverAllowed() {
        assertThat(guard.authorize(null, Optional.of(new Owned(1L))).isAllowed()).isFalse();
    }
}
