package com.sitewatch.monitor.probe;

import com.sitewatch.core.model.Availability;
import com.sitewatch.monitor.api.ProbeResult;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpUrlProbeTest {
    private HttpServer server;
    private ExecutorService serverExecutor;
    private HttpUrlProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/ok", exchange -> respond(exchange, 200));
        server.createContext("/no-content", exchange -> respond(exchange, 204));
        server.createContext("/missing", exchange -> respond(exchange, 404));
        server.createContext("/error", exchange -> respond(exchange, 503));
        server.createContext("/moved", exchange -> {
            exchange.getResponseHeaders().add("Location", "/ok");
            respond(exchange, 301);
        });
        server.createContext("/found", exchange -> {
            exchange.getResponseHeaders().add("Location", "/ok");
            respond(exchange, 302);
        });
        server.createContext("/slow", exchange -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200);
        });
        server.start();

        probe = new HttpUrlProbe(
                HttpClient.newBuilder().connectTimeout(Duration.ofMillis(500)).build(),
                Duration.ofMillis(200),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC)
        );
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void status200WithinTimeoutIsAvailable() {
        ProbeResult result = probe.probe(url("/ok"));

        assertEquals(Availability.AVAILABLE, result.availability());
        assertEquals(200, result.status());
        assertTrue(result.isAvailable());
    }

    @Test
    void any2xxStatusIsAvailable() {
        assertEquals(Availability.AVAILABLE, probe.probe(url("/no-content")).availability());
    }

    @Test
    void notFoundRefusedAndTimeoutAllClassifyAsUnavailable() throws IOException {
        HttpServer closed = HttpServer.create(new InetSocketAddress(0), 0);
        int closedPort = closed.getAddress().getPort();
        closed.stop(0);

        ProbeResult notFound = probe.probe(url("/missing"));
        ProbeResult refused = probe.probe("http://localhost:" + closedPort + "/");
        ProbeResult timedOut = probe.probe(url("/slow"));

        for (ProbeResult result : List.of(notFound, refused, timedOut)) {
            assertEquals(Availability.UNAVAILABLE, result.availability(), result.url());
            assertFalse(result.isAvailable());
            assertTrue(result.failure() != null && !result.failure().isBlank());
        }
        assertEquals(404, notFound.status());
        assertEquals(0, refused.status());
        assertEquals(0, timedOut.status());
        assertTrue(timedOut.failure().toLowerCase(Locale.ROOT).contains("timed out"));
    }

    @Test
    void serverErrorIsUnavailableWithStatus() {
        ProbeResult result = probe.probe(url("/error"));

        assertEquals(Availability.UNAVAILABLE, result.availability());
        assertEquals(503, result.status());
        assertTrue(result.failure().contains("503"));
    }

    @Test
    void redirectIsUnavailableWithItsOwnStatus() {
        ProbeResult moved = probe.probe(url("/moved"));
        ProbeResult found = probe.probe(url("/found"));

        assertEquals(Availability.UNAVAILABLE, moved.availability());
        assertEquals(301, moved.status());
        assertEquals(Availability.UNAVAILABLE, found.availability());
        assertEquals(302, found.status());
    }

    @Test
    void redirectIsUnavailableEvenWhenTheClientFollowsIt() {
        HttpUrlProbe following = new HttpUrlProbe(
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofMillis(500))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                Duration.ofSeconds(2),
                Clock.fixed(Instant.parse("2026-02-09T20:00:00Z"), ZoneOffset.UTC)
        );

        ProbeResult result = following.probe(url("/moved"));

        assertEquals(Availability.UNAVAILABLE, result.availability());
        assertEquals(301, result.status());
        assertTrue(result.failure().contains("301"));
    }

    @Test
    void malformedAndUnsupportedUrlsAreUnavailableNotExceptions() {
        assertEquals(Availability.UNAVAILABLE, probe.probe("not a url").availability());
        assertEquals(Availability.UNAVAILABLE, probe.probe("ftp://example.com/file").availability());
    }

    @Test
    void failureMessagesNameTheFailureKind() {
        assertTrue(HttpUrlProbe.classifyFailureMessage("https://a.example", new java.net.UnknownHostException("a.example"))
                .startsWith("DNS/unknown host"));
        assertTrue(HttpUrlProbe.classifyFailureMessage("https://a.example", new RuntimeException(new TimeoutException()))
                .startsWith("Request timed out"));
        assertTrue(HttpUrlProbe.classifyFailureMessage("https://a.example", new java.net.ConnectException())
                .startsWith("Connection refused"));
    }

    private String url(String path) {
        return "http://localhost:" + server.getAddress().getPort() + path;
    }

    private static void respond(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
        exchange.close();
    }
}
