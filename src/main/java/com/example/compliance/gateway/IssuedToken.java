package com.example.compliance.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token exchange response.
 *
 * @param accessToken       bearer token
 * @param expiresAtEpochMs  server-side expiry, epoch milliseconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IssuedToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("expires_at") long expiresAtEpochMs
) {}
