package com.sitewatch.monitor.dispatch;

import com.sitewatch.core.model.Notification;

public final class NotificationMessages {
    public static final int GREEN = 0x2ECC71;

    private NotificationMessages() {
    }

    public static Notification siteAvailable(long userId, String url) {
        return new Notification(
                "🟢 Website Available!",
                "<@" + userId + "> The website at " + url + " is now accessible.",
                GREEN
        );
    }
}
