package com.example.compliance.gateway;

import java.time.Instant;

/**
 * Cached bearer token. {@code usableUntil} already has the safety margin subtracted.
 */
record AccessToken(String value, Instant usableUntil) {

    boolean isUsableAt(Instant now) {
        return now.isBefore(usableUntil);
    }
}
