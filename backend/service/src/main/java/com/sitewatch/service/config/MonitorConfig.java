package com.sitewatch.service.config;

import com.sitewatch.monitor.dispatch.NotificationPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record MonitorConfig(
        String botToken,
        long adminId,
        Path databasePath,
        Duration urlCheckDelay,
        List<String> urlsToCheck,
        long maxSubscribers,
        Duration probeTimeout,
        NotificationPolicy notificationPolicy,
        int deliveryConcurrency,
        int apiPort
) {
    public static final long DEFAULT_MAX_SUBSCRIBERS = 10_000;
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_DELIVERY_CONCURRENCY = 4;
    public static final int DEFAULT_API_PORT = 8080;

    public MonitorConfig {
        Objects.requireNonNull(botToken, "botToken is required");
        Objects.requireNonNull(databasePath, "databasePath is required");
        Objects.requireNonNull(urlCheckDelay, "urlCheckDelay is required");
        Objects.requireNonNull(probeTimeout, "probeTimeout is required");
        Objects.requireNonNull(notificationPolicy, "notificationPolicy is required");
        urlsToCheck = List.copyOf(urlsToCheck);
    }

    public boolean apiEnabled() {
        return apiPort > 0;
    }

    @Override
    public String toString() {
        return "MonitorConfig[adminId=" + adminId
                + ", databasePath=" + databasePath
                + ", urlCheckDelay=" + urlCheckDelay
                + ", urlsToCheck=" + urlsToCheck
                + ", maxSubscribers=" + maxSubscribers
                + ", probeTimeout=" + probeTimeout
                + ", notificationPolicy=" + notificationPolicy.configValue()
                + ", deliveryConcurrency=" + deliveryConcurrency
                + ", apiPort=" + apiPort + "]";
    }
}
