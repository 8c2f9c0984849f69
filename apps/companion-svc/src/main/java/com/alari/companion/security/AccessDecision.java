package com.alari.companion.security;

import java.util.function.Supplier;

/**
 * Outcome of an ownership check: either the resource is handed back, or nothing is,
 * with no trace of whether it existed.
 */
public final class AccessDecision<T> {

    private static final AccessDecision<?> NOT_FOUND = new AccessDecision<>(null);

    private final T resource;

    private AccessDecision(T resource) {
        this.resource = resource;
    }

    public static <T> AccessDecision<T> allowed(T resource) {
        if (resource == null) {
            throw new IllegalArgumentException("resource is required");
        }
        return new AccessDecision<>(resource);
    }

    @SuppressWarnings("unchecked")
    public static <T> AccessDecision<T> notFound() {
        return (AccessDecision<T>) NOT_FOUND;
    }

    public boolean isAllowed() {
        return resource != null;
    }

    public <X extends RuntimeException> T orElseThrow(Supplier<? extends X> exceptionSupplier) {
        if (resource == null) {
            throw exceptionSupplier.get();
        }
        return resource;
    }
}
