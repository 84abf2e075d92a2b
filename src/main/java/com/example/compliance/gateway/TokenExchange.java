package com.example.compliance.gateway;

/**
 * Trades the long-lived secret for a short-lived access token. One call, no retries.
 */
@FunctionalInterface
public interface TokenExchange {

    /**
     * @throws AuthException if the endpoint rejects the exchange or returns no token
     * @throws org.springframework.web.client.ResourceAccessException on connection failure or timeout
     */
    IssuedToken exchange(String secret);
}
