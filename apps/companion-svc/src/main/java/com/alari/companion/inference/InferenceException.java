package com.alari.companion.inference;

/**
 * Base type for failures talking to the inference service. Never retried automatically.
 */
public abstract class InferenceException extends RuntimeException {

    protected InferenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
