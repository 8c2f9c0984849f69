package com.alari.companion.inference;

public class UpstreamTimeoutException extends InferenceException {

    public UpstreamTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
