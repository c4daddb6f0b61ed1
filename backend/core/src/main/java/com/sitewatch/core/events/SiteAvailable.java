package com.sitewatch.core.events;

import java.time.Instant;
import java.util.Objects;

/**
 * Raised when a monitored URL was observed reachable and subscribers should hear about it.
 */
public record SiteAvailable(Instant timestamp, String url) implements Event {
    public SiteAvailable {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(url, "url is required");
    }

    @Override
    public String type() {
        return "SiteAvailable";
    }
}
