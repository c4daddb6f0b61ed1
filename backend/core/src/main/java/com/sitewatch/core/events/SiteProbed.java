package com.sitewatch.core.events;

import com.sitewatch.core.model.Availability;

import java.time.Instant;

/**
 * Outcome of a single probe. {@code status} is the HTTP status code, or 0 when no response arrived.
 */
public record SiteProbed(
        Instant timestamp,
        String url,
        Availability availability,
        int status,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "SiteProbed";
    }
}
