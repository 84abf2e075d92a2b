package com.example.compliance.gateway;

/**
 * The credential exchange was rejected or returned no token. Fatal for the current call.
 */
public class AuthException extends GatewayClientException {

    public AuthException(String message) {
        super(message, null, 1);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause, 1);
    }

    private AuthException(String message, Throwable cause, int attempts) {
        super(message, cause, attempts);
    }

    /** The same failure, reported as having happened on transport attempt {@code attempt}. */
    AuthException onAttempt(int attempt) {
        if (attempt == attempts()) {
            return this;
        }
        AuthException copy = new AuthException(getMessage(), getCause(), attempt);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
