package com.sitewatch.monitor.api;

public record DeliveryResult(boolean delivered, String reason) {
    public static DeliveryResult success() {
        return new DeliveryResult(true, null);
    }

    public static DeliveryResult failure(String reason) {
        return new DeliveryResult(false, reason);
    }
}
