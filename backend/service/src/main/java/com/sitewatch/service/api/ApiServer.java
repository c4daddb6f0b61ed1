package com.sitewatch.service.api;

import com.sitewatch.core.model.Availability;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.monitor.api.CapacityExceededException;
import com.sitewatch.monitor.api.StorageException;
import com.sitewatch.monitor.api.SubscriberStore;
import com.sitewatch.monitor.dispatch.NotificationPolicy;
import com.sitewatch.monitor.tracker.AvailabilityTracker;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin JSON adapter over the subscriber store and availability tracker, for dashboards and chat front ends.
 * It owns no state.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final String SUBSCRIBERS_PATH = "/api/subscribers/";

    static final String SUBSCRIBED_MESSAGE = "Successfully subscribed to website monitoring!";
    static final String ALREADY_SUBSCRIBED_MESSAGE = "You are already subscribed!";
    static final String UNSUBSCRIBED_MESSAGE = "Successfully unsubscribed from website monitoring!";
    static final String NOT_SUBSCRIBED_MESSAGE = "You are not subscribed!";

    private final int port;
    private final SubscriberStore subscriberStore;
    private final AvailabilityTracker tracker;
    private final NotificationPolicy policy;
    private final DiagnosticsTracker diagnosticsTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            SubscriberStore subscriberStore,
            AvailabilityTracker tracker,
            NotificationPolicy policy,
            DiagnosticsTracker diagnosticsTracker
    ) {
        this.port = port;
        this.subscriberStore = subscriberStore;
        this.tracker = tracker;
        this.policy = policy;
        this.diagnosticsTracker = diagnosticsTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(4);
            server.setExecutor(executor);
            server.createContext("/api/health", guarded(this::handleHealth));
            server.createContext("/api/dashboard", guarded(this::handleDashboard));
            server.createContext("/api/status", guarded(this::handleStatus));
            server.createContext("/api/metrics", guarded(this::handleMetrics));
            server.createContext(SUBSCRIBERS_PATH, guarded(this::handleSubscriber));
            server.start();
            LOGGER.info("API listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleDashboard(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("activeMonitors", tracker.urls().size());
        body.put("subscribers", subscriberStore.count());
        body.put("notificationPolicy", policy.configValue());
        writeJson(exchange, 200, body);
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        List<Map<String, Object>> sites = new ArrayList<>();
        for (Map.Entry<String, Availability> entry : tracker.snapshot().entrySet()) {
            Map<String, Object> site = new LinkedHashMap<>();
            site.put("url", entry.getKey());
            site.put("status", entry.getValue().name());
            site.put("label", entry.getValue().label());
            sites.add(site);
        }
        writeJson(exchange, 200, sites);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET")) {
            return;
        }
        writeJson(exchange, 200, diagnosticsTracker.metricsSnapshot());
    }

    private void handleSubscriber(HttpExchange exchange) throws IOException {
        if (!ensureMethod(exchange, "GET", "PUT", "DELETE")) {
            return;
        }
        long userId;
        try {
            userId = Long.parseLong(exchange.getRequestURI().getPath().substring(SUBSCRIBERS_PATH.length()));
        } catch (NumberFormatException invalidId) {
            userId = 0;
        }
        if (userId <= 0) {
            writeJson(exchange, 400, Map.of("error", "invalid_user_id"));
            return;
        }

        String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        switch (method) {
            case "PUT" -> subscribe(exchange, userId);
            case "DELETE" -> unsubscribe(exchange, userId);
            default -> writeJson(exchange, 200, Map.of("userId", userId, "subscribed", subscriberStore.isSubscribed(userId)));
        }
    }

    private void subscribe(HttpExchange exchange, long userId) throws IOException {
        boolean added;
        try {
            added = subscriberStore.subscribe(userId);
        } catch (CapacityExceededException e) {
            writeJson(exchange, 507, Map.of("error", "capacity_exceeded", "message", e.getMessage()));
            return;
        }
        if (!added) {
            writeJson(exchange, 409, Map.of("message", ALREADY_SUBSCRIBED_MESSAGE, "subscribed", true));
            return;
        }
        writeJson(exchange, 200, Map.of("message", SUBSCRIBED_MESSAGE, "subscribed", true));
    }

    private void unsubscribe(HttpExchange exchange, long userId) throws IOException {
        if (!subscriberStore.unsubscribe(userId)) {
            writeJson(exchange, 409, Map.of("message", NOT_SUBSCRIBED_MESSAGE, "subscribed", false));
            return;
        }
        writeJson(exchange, 200, Map.of("message", UNSUBSCRIBED_MESSAGE, "subscribed", false));
    }

    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (StorageException e) {
                LOGGER.log(Level.WARNING, "Storage failure serving " + exchange.getRequestURI(), e);
                writeJson(exchange, 503, Map.of("error", "storage_unavailable"));
            }
        };
    }

    private boolean ensureMethod(HttpExchange exchange, String... allowed) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
            exchange.getResponseHeaders().set("Access-Control-Allow-Methods", String.join(",", allowed) + ",OPTIONS");
            exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        for (String method : allowed) {
            if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
                return true;
            }
        }
        exchange.sendResponseHeaders(405, -1);
        exchange.close();
        return false;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }
}
