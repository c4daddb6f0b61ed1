package com.sitewatch.monitor.api;

import java.util.Set;

/**
 * Durable set of subscriber identities.
 *
 * <p>Every operation runs in its own transaction. Mutations either fully apply or leave state
 * unchanged, and storage failures surface as {@link StorageException} rather than default values.
 */
public interface SubscriberStore {
    /**
     * Creates the backing structure if absent. Safe to call repeatedly.
     *
     * @throws StorageInitException if the backing medium cannot be opened or written
     */
    void ensureInitialized();

    /**
     * Total number of subscriber records, subscribed or not.
     */
    long count();

    Set<Long> listSubscribed();

    /**
     * Subscribes {@code userId}. Already subscribed is a no-op.
     *
     * @return true if the user was not subscribed before this call
     * @throws CapacityExceededException if a new record would exceed the subscriber cap
     */
    boolean subscribe(long userId);

    /**
     * Unsubscribes {@code userId}. Not subscribed is a no-op.
     *
     * @return true if the user was subscribed before this call
     */
    boolean unsubscribe(long userId);

    boolean isSubscribed(long userId);
}
