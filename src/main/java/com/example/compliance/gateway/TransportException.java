package com.example.compliance.gateway;

/**
 * Retries exhausted on transient faults, or the calling thread was interrupted mid-call.
 */
public class TransportException extends GatewayClientException {

    private final boolean cancelled;

    private TransportException(String message, Throwable cause, int attempts, boolean cancelled) {
        super(message, cause, attempts);
        this.cancelled = cancelled;
    }

    public static TransportException exhausted(String operation, int attempts, Throwable lastCause) {
        return new TransportException(operation + " failed after " + attempts + " attempts: "
                + (lastCause != null ? lastCause.getMessage() : "unknown error"), lastCause, attempts, false);
    }

    public static TransportException cancelled(String operation, int attempts, Throwable cause) {
        return new TransportException(operation + " cancelled on attempt " + attempts, cause, attempts, true);
    }

    /** {@code true} when the call was abandoned because its thread was interrupted. */
    public boolean isCancelled() {
        return cancelled;
    }
}
