package com.sitewatch.core.events;

import java.time.Instant;

public record CycleCompleted(
        Instant timestamp,
        long cycle,
        int probed,
        int available,
        int notified,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "CycleCompleted";
    }
}
