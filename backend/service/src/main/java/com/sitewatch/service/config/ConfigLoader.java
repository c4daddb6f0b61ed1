package com.sitewatch.service.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.monitor.dispatch.NotificationPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads and validates the YAML configuration file. Any problem is reported as a {@link ConfigException}
 * naming the offending key.
 */
public final class ConfigLoader {
    public static final Path DEFAULT_PATH = Path.of("config.yaml");

    private static final List<String> REQUIRED_KEYS =
            List.of("bot_token", "admin_id", "database_path", "url_check_delay", "urls_to_check");

    private ConfigLoader() {
    }

    public static MonitorConfig load(Path path) {
        if (!Files.exists(path)) {
            throw new ConfigException("The config file " + path + " is missing. Copy config.example.yaml and fill it in.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = JsonUtils.yamlMapper().readTree(in);
        } catch (IOException e) {
            throw new ConfigException("Failed loading config from " + path, e);
        }
        return parse(root, path);
    }

    static MonitorConfig parse(JsonNode root, Path source) {
        if (root == null || !root.isObject()) {
            throw new ConfigException(source + " must contain a mapping of configuration keys");
        }
        for (String key : REQUIRED_KEYS) {
            if (!root.has(key) || root.get(key).isNull()) {
                throw new ConfigException(source + " is missing required configuration parameter: " + key);
            }
        }

        String botToken = requiredText(root, "bot_token");
        long adminId = requiredLong(root, "admin_id");
        Path databasePath = Path.of(requiredText(root, "database_path"));
        int delaySeconds = positiveInt(root, "url_check_delay", 0);
        List<String> urls = urlList(root.get("urls_to_check"));

        long maxSubscribers = positiveLong(root, "max_subscribers", MonitorConfig.DEFAULT_MAX_SUBSCRIBERS);
        int timeoutSeconds = positiveInt(root, "probe_timeout_seconds", (int) MonitorConfig.DEFAULT_PROBE_TIMEOUT.toSeconds());
        int concurrency = positiveInt(root, "delivery_concurrency", MonitorConfig.DEFAULT_DELIVERY_CONCURRENCY);
        NotificationPolicy policy = policy(root.path("notification_policy").asText(""));
        int apiPort = apiPort(root);

        return new MonitorConfig(
                botToken,
                adminId,
                databasePath,
                Duration.ofSeconds(delaySeconds),
                urls,
                maxSubscribers,
                Duration.ofSeconds(timeoutSeconds),
                policy,
                concurrency,
                apiPort
        );
    }

    private static String requiredText(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isValueNode() || node.asText().isBlank()) {
            throw new ConfigException("'" + key + "' must be a non-empty string");
        }
        return node.asText().trim();
    }

    private static long requiredLong(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new ConfigException("'" + key + "' must be an integer");
        }
        return node.asLong();
    }

    private static long positiveLong(JsonNode root, String key, long fallback) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong() || node.asLong() <= 0) {
            throw new ConfigException("'" + key + "' must be an integer greater than 0");
        }
        return node.asLong();
    }

    private static int positiveInt(JsonNode root, String key, int fallback) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.asInt() <= 0) {
            throw new ConfigException("'" + key + "' must be an integer between 1 and " + Integer.MAX_VALUE);
        }
        return node.asInt();
    }

    private static List<String> urlList(JsonNode node) {
        if (!node.isArray() || node.isEmpty()) {
            throw new ConfigException("The 'urls_to_check' parameter must be a non-empty list.");
        }
        List<String> urls = new ArrayList<>();
        for (JsonNode entry : node) {
            if (!entry.isTextual() || entry.asText().isBlank()) {
                throw new ConfigException("Every entry of 'urls_to_check' must be a URL string");
            }
            String url = entry.asText().trim();
            validateUrl(url);
            urls.add(url);
        }
        return urls;
    }

    private static void validateUrl(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new ConfigException("Not an absolute http(s) URL in 'urls_to_check': " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigException("Malformed URL in 'urls_to_check': " + url, e);
        }
    }

    private static NotificationPolicy policy(String raw) {
        try {
            return NotificationPolicy.fromConfig(raw);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("'notification_policy' must be every_observation or transition_only, got: " + raw, e);
        }
    }

    private static int apiPort(JsonNode root) {
        JsonNode node = root.get("api_port");
        if (node == null || node.isNull()) {
            return MonitorConfig.DEFAULT_API_PORT;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt() || node.asInt() < 0 || node.asInt() > 65_535) {
            throw new ConfigException("'api_port' must be an integer between 0 and 65535");
        }
        return node.asInt();
    }
}
