package com.alari.companion.inference;

/** Connection-level failure: refused, reset, unresolvable host. */
public class UpstreamUnavailableException extends InferenceException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
