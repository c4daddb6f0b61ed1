package com.sitewatch.monitor.loop;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CycleCompleted;
import com.sitewatch.core.events.CycleStarted;
import com.sitewatch.core.events.SiteAvailable;
import com.sitewatch.core.events.SiteProbed;
import com.sitewatch.core.model.Availability;
import com.sitewatch.monitor.api.ProbeResult;
import com.sitewatch.monitor.api.UrlProbe;
import com.sitewatch.monitor.dispatch.DispatchSummary;
import com.sitewatch.monitor.dispatch.NotificationDispatcher;
import com.sitewatch.monitor.dispatch.NotificationPolicy;
import com.sitewatch.monitor.tracker.AvailabilityTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes every monitored URL, records the results and notifies subscribers, then waits a fixed delay
 * before the next cycle. The period is therefore the cycle duration plus the delay.
 *
 * <p>A cycle has two phases: all URLs are probed and recorded in configured order first, then the
 * collected availability events are dispatched in the same order.
 */
public class MonitorLoop {
    private static final Logger LOGGER = Logger.getLogger(MonitorLoop.class.getName());

    private final AvailabilityTracker tracker;
    private final UrlProbe probe;
    private final NotificationDispatcher dispatcher;
    private final NotificationPolicy policy;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration delay;
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicBoolean started = new AtomicBoolean();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "monitor-loop");
        thread.setDaemon(true);
        return thread;
    });

    public MonitorLoop(
            AvailabilityTracker tracker,
            UrlProbe probe,
            NotificationDispatcher dispatcher,
            NotificationPolicy policy,
            EventBus eventBus,
            Clock clock,
            Duration delay
    ) {
        this.tracker = Objects.requireNonNull(tracker, "tracker is required");
        this.probe = Objects.requireNonNull(probe, "probe is required");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.delay = Objects.requireNonNull(delay, "delay is required");
        if (delay.isNegative() || delay.isZero()) {
            throw new IllegalArgumentException("delay must be positive");
        }
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Monitor loop already started");
        }
        LOGGER.info("Monitoring " + tracker.urls().size() + " urls every " + delay.toSeconds() + "s after each cycle");
        timerExecutor.scheduleWithFixedDelay(this::runCycleSafely, 0, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CycleReport runCycle() {
        long cycle = cycles.incrementAndGet();
        Instant startedAt = clock.instant();
        eventBus.publish(new CycleStarted(startedAt, cycle, tracker.urls().size()));

        List<ProbeResult> results = new ArrayList<>();
        List<SiteAvailable> pending = new ArrayList<>();
        for (String url : tracker.urls()) {
            ProbeResult result = probeSafely(url);
            Availability previous = tracker.record(url, result.isAvailable());
            results.add(result);
            eventBus.publish(new SiteProbed(
                    clock.instant(),
                    url,
                    result.availability(),
                    result.status(),
                    result.durationMillis()
            ));
            if (result.isAvailable()) {
                LOGGER.fine("Url '" + url + "' available");
            } else {
                LOGGER.fine("Url '" + url + "' not available: " + result.failure());
            }
            if (policy.shouldNotify(previous, result.availability())) {
                pending.add(new SiteAvailable(clock.instant(), url));
            }
        }

        List<DispatchSummary> dispatches = new ArrayList<>();
        for (SiteAvailable event : pending) {
            eventBus.publish(event);
            try {
                dispatches.add(dispatcher.dispatch(event));
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Dispatch failed for " + event.url(), e);
                eventBus.publish(new AlertRaised(
                        clock.instant(),
                        "monitor",
                        "Dispatch failed for " + event.url() + ": " + e.getMessage(),
                        Map.of("url", event.url(), "cycle", cycle)
                ));
            }
        }

        long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
        CycleReport report = new CycleReport(cycle, results, dispatches, durationMillis);
        eventBus.publish(new CycleCompleted(
                clock.instant(),
                cycle,
                results.size(),
                (int) report.availableCount(),
                pending.size(),
                durationMillis
        ));
        return report;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        dispatcher.close();
    }

    public long cycleCount() {
        return cycles.get();
    }

    private ProbeResult probeSafely(String url) {
        try {
            ProbeResult result = probe.probe(url);
            if (result == null) {
                return ProbeResult.unavailable(url, 0, 0, "Probe returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Probe failed unexpectedly for " + url, e);
            return ProbeResult.unavailable(url, 0, 0, "Probe failure for " + url + ": " + e.getMessage());
        }
    }

    private void runCycleSafely() {
        try {
            CycleReport report = runCycle();
            LOGGER.info("Cycle " + report.cycle() + ": " + report.availableCount() + "/" + report.probes().size()
                    + " urls available, " + report.deliveredCount() + " notifications sent, "
                    + report.failedCount() + " failed");
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Monitor cycle failed", e);
        }
    }
}
