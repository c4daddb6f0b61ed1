package com.sitewatch.monitor.dispatch;

public record DispatchSummary(String url, int attempted, int delivered, int failed) {
    public static DispatchSummary skipped(String url) {
        return new DispatchSummary(url, 0, 0, 0);
    }
}
