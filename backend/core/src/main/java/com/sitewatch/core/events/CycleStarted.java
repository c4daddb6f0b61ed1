package com.sitewatch.core.events;

import java.time.Instant;

public record CycleStarted(Instant timestamp, long cycle, int urlCount) implements Event {
    @Override
    public String type() {
        return "CycleStarted";
    }
}
