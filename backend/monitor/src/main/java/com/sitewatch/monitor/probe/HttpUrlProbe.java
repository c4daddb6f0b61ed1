package com.sitewatch.monitor.probe;

import com.sitewatch.monitor.api.ProbeResult;
import com.sitewatch.monitor.api.UrlProbe;

import java.net.ConnectException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Probes a URL with a single HEAD request. Only a 2xx response within the timeout counts as available.
 * Redirects are not followed; a 3xx answer is unavailable even when the client is configured to follow it.
 */
public class HttpUrlProbe implements UrlProbe {
    private final HttpClient httpClient;
    private final Duration timeout;
    private final Clock clock;

    public HttpUrlProbe(HttpClient httpClient, Duration timeout, Clock clock) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public ProbeResult probe(String url) {
        Instant startedAt = clock.instant();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .method("HEAD", HttpRequest.BodyPublishers.noBody())
                    .timeout(timeout)
                    .build();
        } catch (IllegalArgumentException e) {
            return ProbeResult.unavailable(url, 0, 0, "Invalid URL " + url + ": " + e.getMessage());
        }

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    long durationMillis = Duration.between(startedAt, clock.instant()).toMillis();
                    if (error != null) {
                        return ProbeResult.unavailable(url, 0, durationMillis, classifyFailureMessage(url, error));
                    }
                    int status = firstResponse(response).statusCode();
                    if (status / 100 != 2) {
                        return ProbeResult.unavailable(url, status, durationMillis, "HTTP status " + status + " from " + url);
                    }
                    return ProbeResult.available(url, status, durationMillis);
                })
                .join();
    }

    static String classifyFailureMessage(String url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException
                || lowered.contains("unknown host")
                || lowered.contains("name or service")
                || lowered.contains("nodename")) {
            return "DNS/unknown host while probing " + url + ": " + rootText;
        }
        if (root instanceof TimeoutException || root instanceof HttpTimeoutException || lowered.contains("timed out")) {
            return "Request timed out while probing " + url;
        }
        if (root instanceof ConnectException) {
            return "Connection refused while probing " + url;
        }
        return "Probe failure for " + url + ": " + rootText;
    }

    private static HttpResponse<?> firstResponse(HttpResponse<?> response) {
        HttpResponse<?> current = response;
        while (current.previousResponse().isPresent()) {
            current = current.previousResponse().get();
        }
        return current;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
