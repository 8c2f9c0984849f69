package com.alari.companion.security;

/**
 * Raised when a resource is missing or owned by someone else. Both cases share one message
 * so callers cannot probe for other accounts' records.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public static ResourceNotFoundException conversation() {
        return new ResourceNotFoundException("Conversation not found");
    }

    public static ResourceNotFoundException goal() {
        return new ResourceNotFoundException("Goal not found");
    }

    public static ResourceNotFoundException checkIn() {
        return new ResourceNotFoundException("Check-in not found");
    }
}
