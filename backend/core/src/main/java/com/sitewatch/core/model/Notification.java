package com.sitewatch.core.model;

import java.util.Objects;

/**
 * Message handed to a delivery channel. {@code color} is an RGB value such as {@code 0x2ECC71}.
 */
public record Notification(String title, String description, int color) {
    public Notification {
        Objects.requireNonNull(title, "title is required");
        Objects.requireNonNull(description, "description is required");
    }
}
