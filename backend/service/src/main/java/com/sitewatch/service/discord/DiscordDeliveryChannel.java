package com.sitewatch.service.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitewatch.core.model.Notification;
import com.sitewatch.core.util.JsonUtils;
import com.sitewatch.monitor.api.DeliveryChannel;
import com.sitewatch.monitor.api.DeliveryResult;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sends notifications as Discord direct messages through the REST API: the DM channel is opened
 * (and cached) first, then the notification is posted to it as an embed.
 */
public final class DiscordDeliveryChannel implements DeliveryChannel {
    public static final URI DEFAULT_API_BASE = URI.create("https://discord.com/api/v10/");

    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final HttpClient httpClient;
    private final String botToken;
    private final Duration timeout;
    private final URI apiBase;
    private final Map<Long, String> dmChannels = new ConcurrentHashMap<>();

    public DiscordDeliveryChannel(HttpClient httpClient, String botToken, Duration timeout) {
        this(httpClient, botToken, timeout, DEFAULT_API_BASE);
    }

    public DiscordDeliveryChannel(HttpClient httpClient, String botToken, Duration timeout, URI apiBase) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.botToken = Objects.requireNonNull(botToken, "botToken is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
        String base = apiBase.toString();
        this.apiBase = URI.create(base.endsWith("/") ? base : base + "/");
    }

    @Override
    public DeliveryResult send(long userId, Notification notification) {
        try {
            String channelId = dmChannels.get(userId);
            if (channelId == null) {
                channelId = openDirectMessageChannel(userId);
                dmChannels.put(userId, channelId);
            }

            ObjectNode embed = MAPPER.createObjectNode()
                    .put("title", notification.title())
                    .put("description", notification.description())
                    .put("color", notification.color());
            ObjectNode body = MAPPER.createObjectNode();
            body.putArray("embeds").add(embed);

            HttpResponse<String> response = post("channels/" + channelId + "/messages", body);
            if (response.statusCode() / 100 != 2) {
                if (response.statusCode() == 404) {
                    dmChannels.remove(userId);
                }
                return DeliveryResult.failure("Discord returned HTTP " + response.statusCode() + " sending message to user " + userId);
            }
            return DeliveryResult.success();
        } catch (DiscordApiException e) {
            return DeliveryResult.failure(e.getMessage());
        } catch (IOException e) {
            return DeliveryResult.failure("Discord request failed for user " + userId + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.failure("Interrupted while notifying user " + userId);
        }
    }

    int cachedChannelCount() {
        return dmChannels.size();
    }

    private String openDirectMessageChannel(long userId) throws IOException, InterruptedException {
        ObjectNode body = MAPPER.createObjectNode().put("recipient_id", Long.toString(userId));
        HttpResponse<String> response = post("users/@me/channels", body);
        if (response.statusCode() / 100 != 2) {
            throw new DiscordApiException("Discord returned HTTP " + response.statusCode() + " opening DM channel for user " + userId);
        }
        JsonNode channel = MAPPER.readTree(response.body());
        String channelId = channel.path("id").asText("");
        if (channelId.isBlank()) {
            throw new DiscordApiException("Discord DM channel response for user " + userId + " has no id");
        }
        return channelId;
    }

    private HttpResponse<String> post(String path, JsonNode body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(apiBase.resolve(path))
                .timeout(timeout)
                .header("Authorization", "Bot " + botToken)
                .header("Content-Type", "application/json")
                .header("User-Agent", "DiscordBot (site-watch, 0.1)")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static final class DiscordApiException extends RuntimeException {
        private DiscordApiException(String message) {
            super(message);
        }
    }
}
