package com.sitewatch.core.model;

/**
 * Last observed reachability of a monitored URL. {@link #UNKNOWN} means no probe has completed yet
 * and is never the same thing as {@link #UNAVAILABLE}.
 */
public enum Availability {
    AVAILABLE("Online"),
    UNAVAILABLE("Offline"),
    UNKNOWN("Unknown");

    private final String label;

    Availability(String label) {
        this.label = label;
    }

    public static Availability of(boolean available) {
        return available ? AVAILABLE : UNAVAILABLE;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public String label() {
        return label;
    }
}
