package com.example.compliance.gateway;

/**
 * Base of the gateway error taxonomy. Carries the number of transport attempts made
 * before the failure surfaced.
 */
public abstract class GatewayClientException extends RuntimeException {

    private final int attempts;

    protected GatewayClientException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
