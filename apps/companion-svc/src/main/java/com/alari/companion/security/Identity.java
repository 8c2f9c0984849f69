package com.alari.companion.security;

/**
 * Authenticated caller as resolved by {@link IdentityGate}.
 */
public record Identity(Long id, String email, String userName) {
}
