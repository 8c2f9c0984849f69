package com.alari.companion.security;

/**
 * A record that belongs to exactly one user. Ownership never changes after creation.
 */
public interface OwnedResource {

    Long getUserId();
}
