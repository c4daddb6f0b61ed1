package com.sitewatch.monitor.api;

/**
 * A single bounded-timeout reachability check against one URL.
 * Implementations classify every failure as unavailable instead of throwing.
 */
@FunctionalInterface
public interface UrlProbe {
    ProbeResult probe(String url);
}
