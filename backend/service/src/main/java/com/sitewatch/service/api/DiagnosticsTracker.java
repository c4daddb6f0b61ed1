package com.sitewatch.service.api;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.CycleCompleted;
import com.sitewatch.core.events.CycleStarted;
import com.sitewatch.core.events.DeliveryFailed;
import com.sitewatch.core.events.Event;
import com.sitewatch.core.events.SiteAvailable;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory view of recent monitor activity. Nothing here is persisted; a restart starts from zero.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder availabilityEventsTotal = new LongAdder();
    private final LongAdder deliveryFailuresTotal = new LongAdder();
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final AtomicReference<CycleStatus> cycleStatus = new AtomicReference<>(CycleStatus.empty());

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        eventBus.subscribeAll(this::onAnyEvent);
        eventBus.subscribe(CycleStarted.class, this::onCycleStarted);
        eventBus.subscribe(CycleCompleted.class, this::onCycleCompleted);
        eventBus.subscribe(SiteAvailable.class, event -> availabilityEventsTotal.increment());
        eventBus.subscribe(DeliveryFailed.class, this::onDeliveryFailed);
        eventBus.subscribe(AlertRaised.class, event -> cycleStatus.updateAndGet(status -> status.withLastError(event.message())));
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        metrics.put("recentEventsPerMinute", recentEventsPerMinute());
        metrics.put("availabilityEventsTotal", availabilityEventsTotal.longValue());
        metrics.put("deliveryFailuresTotal", deliveryFailuresTotal.longValue());
        metrics.put("monitor", cycleStatus.get().toMap());
        return metrics;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onCycleStarted(CycleStarted event) {
        cycleStatus.updateAndGet(status -> status.withStart(event.timestamp(), event.cycle()));
    }

    private void onCycleCompleted(CycleCompleted event) {
        cycleStatus.updateAndGet(status -> status.withCompletion(event));
    }

    private void onDeliveryFailed(DeliveryFailed event) {
        deliveryFailuresTotal.increment();
        cycleStatus.updateAndGet(status -> status.withLastError(
                "Delivery to " + event.userId() + " failed: " + event.reason()));
    }

    private record CycleStatus(
            Long cycle,
            Instant lastStartedAt,
            Instant lastCompletedAt,
            Long lastDurationMillis,
            Integer lastAvailable,
            Integer lastProbed,
            String lastErrorMessage
    ) {
        private static CycleStatus empty() {
            return new CycleStatus(null, null, null, null, null, null, null);
        }

        private CycleStatus withStart(Instant startedAt, long cycle) {
            return new CycleStatus(cycle, startedAt, lastCompletedAt, lastDurationMillis, lastAvailable, lastProbed, lastErrorMessage);
        }

        private CycleStatus withCompletion(CycleCompleted event) {
            return new CycleStatus(
                    event.cycle(),
                    lastStartedAt,
                    event.timestamp(),
                    event.durationMillis(),
                    event.available(),
                    event.probed(),
                    lastErrorMessage
            );
        }

        private CycleStatus withLastError(String message) {
            return new CycleStatus(cycle, lastStartedAt, lastCompletedAt, lastDurationMillis, lastAvailable, lastProbed, message);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("cycle", cycle);
            map.put("lastStartedAt", lastStartedAt == null ? null : lastStartedAt.toString());
            map.put("lastCompletedAt", lastCompletedAt == null ? null : lastCompletedAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastAvailable", lastAvailable);
            map.put("lastProbed", lastProbed);
            map.put("lastErrorMessage", lastErrorMessage);
            return map;
        }
    }
}
