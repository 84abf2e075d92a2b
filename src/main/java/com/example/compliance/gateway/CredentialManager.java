package com.example.compliance.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the gateway credential: the long-lived secret and the cached access token.
 * <p>
 * Reads of a usable cached token take no lock. A refresh runs under {@link #refreshLock} with a
 * second check inside, so concurrent callers that find the token expired collapse onto a single
 * exchange. A failed exchange leaves the cached state as it was.
 * <p>
 * One instance per process, injected wherever a token is needed.
 */
public class CredentialManager {

    private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

    private final String secret;
    private final TokenExchange exchange;
    private final Duration safetyMargin;
    private final Clock clock;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<AccessToken> current = new AtomicReference<>();
    private final AtomicInteger refreshCount = new AtomicInteger();

    public CredentialManager(String secret, TokenExchange exchange, Duration safetyMargin, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Gateway credential secret is not configured");
        }
        if (safetyMargin == null || safetyMargin.isNegative()) {
            throw new IllegalArgumentException("Token safety margin must be >= 0");
        }
        this.secret = secret;
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.safetyMargin = safetyMargin;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns a bearer token that is valid for at least the safety margin, refreshing it first
     * if it is absent or expired.
     *
     * @throws AuthException if a refresh was needed and the exchange failed
     * @throws ResourceAccessException if the auth endpoint could not be reached
     */
    public String token() {
        AccessToken cached = current.get();
        if (cached != null && cached.isUsableAt(clock.instant())) {
            return cached.value();
        }

        refreshLock.lock();
        try {
            cached = current.get();
            if (cached != null && cached.isUsableAt(clock.instant())) {
                return cached.value();
            }
            AccessToken fresh = refresh();
            current.set(fresh);
            return fresh.value();
        } finally {
            refreshLock.unlock();
        }
    }

    /**
     * Drops the cached token if it is still the one the gateway rejected. A token refreshed in
     * the meantime by another caller is kept.
     */
    public void invalidate(String rejectedToken) {
        AccessToken cached = current.get();
        if (cached != null && cached.value().equals(rejectedToken) && current.compareAndSet(cached, null)) {
            log.info("CredentialManager: access token rejected by gateway, will refresh on next use");
        }
    }

    public boolean hasUsableToken() {
        AccessToken cached = current.get();
        return cached != null && cached.isUsableAt(clock.instant());
    }

    /** Number of successful exchanges so far. */
    public int refreshCount() {
        return refreshCount.get();
    }

    private AccessToken refresh() {
        IssuedToken issued;
        try {
            issued = exchange.exchange(secret);
        } catch (ResourceAccessException e) {
            log.warn("CredentialManager: auth endpoint unreachable: {}", e.getMessage());
            throw e;
        } catch (AuthException e) {
            log.error("CredentialManager: token exchange failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("CredentialManager: token exchange failed: {}", e.getMessage());
            throw new AuthException("Token exchange failed: " + e.getMessage(), e);
        }
        if (issued == null || issued.accessToken() == null || issued.accessToken().isBlank()) {
            throw new AuthException("Token exchange returned no access_token");
        }

        Instant usableUntil = Instant.ofEpochMilli(issued.expiresAtEpochMs()).minus(safetyMargin);
        if (!usableUntil.isAfter(clock.instant())) {
            log.warn("CredentialManager: issued token expires within the safety margin ({}), using it once",
                    safetyMargin);
        }
        refreshCount.incrementAndGet();
        log.info("CredentialManager: obtained new access token, usable until {}", usableUntil);
        return new AccessToken(issued.accessToken(), usableUntil);
    }
}
