package com.sitewatch.core.events;

import java.time.Instant;

public record DeliveryFailed(
        Instant timestamp,
        String url,
        long userId,
        String reason
) implements Event {
    @Override
    public String type() {
        return "DeliveryFailed";
    }
}
