package com.sitewatch.monitor.api;

import com.sitewatch.core.model.Notification;

/**
 * Outbound channel that reaches a subscriber. There is no delivery receipt beyond the
 * immediate transport-level outcome.
 */
public interface DeliveryChannel {
    DeliveryResult send(long userId, Notification notification);
}
