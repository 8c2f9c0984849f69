package com.alari.companion.security;

import java.util.Optional;

/**
 * Per-request trace and caller information, populated by {@link TraceIdFilter} and
 * {@link AuthenticatedUserFilter}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static void setUserId(Long userId) {
        RequestContext current = CONTEXT.get();
        CONTEXT.set(new RequestContext(userId, current != null ? current.traceId() : null));
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public static void clear() {
        CONTEXT.remove();
    }

    public record RequestContext(Long userId, String traceId) {

        public static RequestContext ofTrace(String traceId) {
            return new RequestContext(null, traceId);
        }
    }
}
