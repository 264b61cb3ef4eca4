package com.studioflow.orchestrator.agent;

/**
 * The text-completion provider failed. Fatal for the current execution;
 * the thread stays resumable from its last checkpoint.
 */
public class ProviderException extends RuntimeException {

    private final int statusCode;

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ProviderException(int statusCode, String body) {
        super("Provider error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the provider, or -1 when the call never got a response. */
    public int statusCode() { return statusCode; }
}
