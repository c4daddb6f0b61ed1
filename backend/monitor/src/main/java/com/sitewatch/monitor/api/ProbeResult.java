package com.sitewatch.monitor.api;

import com.sitewatch.core.model.Availability;

import java.util.Objects;

/**
 * @param status HTTP status code, 0 when no response was received
 * @param failure short reason when unavailable, null otherwise
 */
public record ProbeResult(String url, Availability availability, int status, long durationMillis, String failure) {
    public ProbeResult {
        Objects.requireNonNull(url, "url is required");
        Objects.requireNonNull(availability, "availability is required");
        if (!availability.isKnown()) {
            throw new IllegalArgumentException("A probe result must be AVAILABLE or UNAVAILABLE");
        }
    }

    public static ProbeResult available(String url, int status, long durationMillis) {
        return new ProbeResult(url, Availability.AVAILABLE, status, durationMillis, null);
    }

    public static ProbeResult unavailable(String url, int status, long durationMillis, String failure) {
        return new ProbeResult(url, Availability.UNAVAILABLE, status, durationMillis, failure);
    }

    public boolean isAvailable() {
        return availability == Availability.AVAILABLE;
    }
}
