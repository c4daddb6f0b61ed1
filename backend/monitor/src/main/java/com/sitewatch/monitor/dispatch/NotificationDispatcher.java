package com.sitewatch.monitor.dispatch;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.core.events.AlertRaised;
import com.sitewatch.core.events.DeliveryFailed;
import com.sitewatch.core.events.SiteAvailable;
import com.sitewatch.monitor.api.DeliveryChannel;
import com.sitewatch.monitor.api.DeliveryResult;
import com.sitewatch.monitor.api.StorageException;
import com.sitewatch.monitor.api.SubscriberStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans an availability event out to every current subscriber.
 *
 * <p>Sends run on a bounded pool and {@link #dispatch} waits for all of them. A failed send is logged
 * and published as {@link DeliveryFailed}; it never aborts the remaining sends and is not retried.
 */
public class NotificationDispatcher implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());

    private final SubscriberStore subscriberStore;
    private final DeliveryChannel deliveryChannel;
    private final EventBus eventBus;
    private final Clock clock;
    private final ExecutorService deliveryExecutor;

    public NotificationDispatcher(
            SubscriberStore subscriberStore,
            DeliveryChannel deliveryChannel,
            EventBus eventBus,
            Clock clock,
            int concurrency
    ) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        this.subscriberStore = Objects.requireNonNull(subscriberStore, "subscriberStore is required");
        this.deliveryChannel = Objects.requireNonNull(deliveryChannel, "deliveryChannel is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.deliveryExecutor = Executors.newFixedThreadPool(concurrency, daemonThreads());
    }

    public DispatchSummary dispatch(SiteAvailable event) {
        Set<Long> recipients;
        try {
            recipients = subscriberStore.listSubscribed();
        } catch (StorageException e) {
            LOGGER.log(Level.WARNING, "Could not read subscribers for " + event.url(), e);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "dispatcher",
                    "Subscriber lookup failed: " + e.getMessage(),
                    Map.of("url", event.url())
            ));
            return DispatchSummary.skipped(event.url());
        }

        List<Future<Boolean>> sends = new ArrayList<>(recipients.size());
        for (Long userId : recipients) {
            sends.add(deliveryExecutor.submit(() -> deliver(event, userId)));
        }

        int delivered = 0;
        int failed = 0;
        for (int i = 0; i < sends.size(); i++) {
            try {
                if (sends.get(i).get()) {
                    delivered++;
                } else {
                    failed++;
                }
            } catch (ExecutionException e) {
                LOGGER.log(Level.WARNING, "Delivery task failed for " + event.url(), e.getCause());
                failed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                for (int j = i; j < sends.size(); j++) {
                    sends.get(j).cancel(true);
                }
                failed += sends.size() - i;
                break;
            }
        }

        LOGGER.info("Notified " + delivered + "/" + sends.size() + " subscribers that " + event.url() + " is available");
        return new DispatchSummary(event.url(), sends.size(), delivered, failed);
    }

    private boolean deliver(SiteAvailable event, long userId) {
        String reason;
        try {
            DeliveryResult result = deliveryChannel.send(userId, NotificationMessages.siteAvailable(userId, event.url()));
            if (result != null && result.delivered()) {
                return true;
            }
            reason = result == null || result.reason() == null ? "delivery rejected" : result.reason();
            LOGGER.warning("Error notifying user " + userId + ": " + reason);
        } catch (RuntimeException e) {
            reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            LOGGER.log(Level.WARNING, "Error notifying user " + userId, e);
        }
        eventBus.publish(new DeliveryFailed(clock.instant(), event.url(), userId, reason));
        return false;
    }

    @Override
    public void close() {
        deliveryExecutor.shutdown();
        try {
            if (!deliveryExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                deliveryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "delivery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
