package com.sitewatch.monitor.tracker;

import com.sitewatch.core.model.Availability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last observed availability per monitored URL, held in memory only.
 *
 * <p>Every configured URL reports {@link Availability#UNKNOWN} until it has been probed, so a fresh
 * instance (process restart) knows nothing about any site. Reads and writes may come from different
 * threads.
 */
public class AvailabilityTracker {
    private final List<String> urls;
    private final Map<String, Availability> states = new ConcurrentHashMap<>();

    public AvailabilityTracker(List<String> urls) {
        Objects.requireNonNull(urls, "urls is required");
        this.urls = List.copyOf(urls);
    }

    /**
     * Overwrites the state of {@code url} and returns what it was before.
     */
    public Availability record(String url, boolean available) {
        Availability previous = states.put(url, Availability.of(available));
        return previous == null ? Availability.UNKNOWN : previous;
    }

    public Availability statusOf(String url) {
        return states.getOrDefault(url, Availability.UNKNOWN);
    }

    public List<String> urls() {
        return urls;
    }

    /**
     * State of every configured URL, in configured order.
     */
    public Map<String, Availability> snapshot() {
        Map<String, Availability> snapshot = new LinkedHashMap<>();
        for (String url : urls) {
            snapshot.put(url, statusOf(url));
        }
        return snapshot;
    }
}
