package com.sitewatch.monitor.loop;

import com.sitewatch.monitor.api.ProbeResult;
import com.sitewatch.monitor.dispatch.DispatchSummary;

import java.util.List;

public record CycleReport(long cycle, List<ProbeResult> probes, List<DispatchSummary> dispatches, long durationMillis) {
    public CycleReport {
        probes = List.copyOf(probes);
        dispatches = List.copyOf(dispatches);
    }

    public long availableCount() {
        return probes.stream().filter(ProbeResult::isAvailable).count();
    }

    public int deliveredCount() {
        return dispatches.stream().mapToInt(DispatchSummary::delivered).sum();
    }

    public int failedCount() {
        return dispatches.stream().mapToInt(DispatchSummary::failed).sum();
    }
}
