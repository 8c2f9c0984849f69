package com.alari.companion.inference;

/** Non-2xx status, or a body that is unreadable or incomplete. */
public class UpstreamProtocolException extends InferenceException {

    public UpstreamProtocolException(String message) {
        super(message, null);
    }

    public UpstreamProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
