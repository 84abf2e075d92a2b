package com.example.compliance.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Executes one authorized gateway call with bounded retries.
 * <p>
 * Each attempt fetches the bearer token from the {@link CredentialManager} and runs the call; a
 * token refresh that cannot reach the auth endpoint counts as a failed attempt. A failure is classified into an {@link Outcome}:
 * <ul>
 *   <li>{@code TRANSIENT}: connection refused/reset or timeout, retried after backoff</li>
 *   <li>{@code AUTH_REJECTED}: HTTP 401/403, the token is invalidated and the call retried</li>
 *   <li>{@code CANCELLED}: the thread was interrupted, the call is abandoned at once</li>
 *   <li>{@code FATAL}: anything else, rethrown unchanged without retry</li>
 * </ul>
 * Backoff sleeps happen on the calling thread, outside the credential lock, and each
 * {@link #execute} call has its own attempt budget.
 */
public class ResilientTransport {

    private static final Logger log = LoggerFactory.getLogger(ResilientTransport.class);

    /** A call that needs the bearer token of the current attempt. */
    @FunctionalInterface
    public interface AuthorizedCall<T> {
        T call(String bearerToken);
    }

    /** Value returned by a successful call together with the attempts it took. */
    public record Delivery<T>(T value, int attempts) {}

    enum Outcome { TRANSIENT, AUTH_REJECTED, CANCELLED, FATAL }

    private final RetryPolicy policy;
    private final CredentialManager credentials;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;

    public ResilientTransport(RetryPolicy policy, CredentialManager credentials) {
        this(policy, credentials, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble());
    }

    ResilientTransport(RetryPolicy policy, CredentialManager credentials, Sleeper sleeper, DoubleSupplier jitter) {
        this.policy = policy;
        this.credentials = credentials;
        this.sleeper = sleeper;
        this.jitter = jitter;
    }

    /**
     * Runs {@code call} until it succeeds, fails fatally, or the attempts are used up.
     *
     * @param operation name used in logs and error messages
     * @throws TransportException after {@code maxAttempts} transient failures, or on interruption
     * @throws RuntimeException   the original exception of a fatal failure; an {@link AuthException}
     *                            is rethrown with the number of the attempt it ended
     */
    public <T> Delivery<T> execute(String operation, AuthorizedCall<T> call) {
        RuntimeException lastFailure = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw TransportException.cancelled(operation, attempt, lastFailure);
            }

            String token = null;
            try {
                token = credentials.token();
                return new Delivery<>(call.call(token), attempt);
            } catch (RuntimeException e) {
                lastFailure = e;
                Outcome outcome = classify(e);
                switch (outcome) {
                    case FATAL -> {
                        log.error("{}: fatal failure on attempt {}/{}: {}",
                                operation, attempt, policy.maxAttempts(), e.getMessage());
                        if (e instanceof AuthException auth) {
                            throw auth.onAttempt(attempt);
                        }
                        throw e;
                    }
                    case CANCELLED -> throw TransportException.cancelled(operation, attempt, e);
                    case AUTH_REJECTED -> {
                        if (token != null) {
                            credentials.invalidate(token);
                        }
                    }
                    case TRANSIENT -> { }
                }
            }

            if (attempt < policy.maxAttempts()) {
                Duration delay = policy.backoff(attempt, jitter.getAsDouble());
                log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms",
                        operation, attempt, policy.maxAttempts(), rootCauseMessage(lastFailure), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw TransportException.cancelled(operation, attempt, ie);
                }
            }
        }

        log.error("{}: all {} attempts failed, last error: {}",
                operation, policy.maxAttempts(), rootCauseMessage(lastFailure));
        throw TransportException.exhausted(operation, policy.maxAttempts(), lastFailure);
    }

    static Outcome classify(RuntimeException e) {
        if (Thread.currentThread().isInterrupted()) {
            return Outcome.CANCELLED;
        }
        if (e instanceof ResourceAccessException) {
            return Outcome.TRANSIENT;
        }
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            if (status == 401 || status == 403) {
                return Outcome.AUTH_REJECTED;
            }
        }
        return Outcome.FATAL;
    }

    private static String rootCauseMessage(Throwable e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
