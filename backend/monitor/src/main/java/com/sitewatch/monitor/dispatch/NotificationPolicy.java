package com.sitewatch.monitor.dispatch;

import com.sitewatch.core.model.Availability;

import java.util.Locale;

/**
 * Decides whether an available observation becomes a subscriber notification.
 */
public enum NotificationPolicy {
    /**
     * Notify on every cycle in which the URL is available.
     */
    EVERY_OBSERVATION {
        @Override
        public boolean shouldNotify(Availability previous, Availability current) {
            return current == Availability.AVAILABLE;
        }
    },
    /**
     * Notify only when the URL was not already known to be available. A restart counts as a transition.
     */
    TRANSITION_ONLY {
        @Override
        public boolean shouldNotify(Availability previous, Availability current) {
            return current == Availability.AVAILABLE && previous != Availability.AVAILABLE;
        }
    };

    public abstract boolean shouldNotify(Availability previous, Availability current);

    public static NotificationPolicy fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return EVERY_OBSERVATION;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String configValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
