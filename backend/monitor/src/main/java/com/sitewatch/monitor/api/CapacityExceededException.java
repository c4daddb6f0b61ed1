package com.sitewatch.monitor.api;

public class CapacityExceededException extends RuntimeException {
    private final long cap;

    public CapacityExceededException(long cap) {
        super("Subscriber limit of " + cap + " reached");
        this.cap = cap;
    }

    public long cap() {
        return cap;
    }
}
