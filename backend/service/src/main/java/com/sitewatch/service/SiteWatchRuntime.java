package com.sitewatch.service;

import com.sitewatch.core.bus.EventBus;
import com.sitewatch.monitor.api.DeliveryChannel;
import com.sitewatch.monitor.dispatch.NotificationDispatcher;
import com.sitewatch.monitor.loop.MonitorLoop;
import com.sitewatch.monitor.probe.HttpUrlProbe;
import com.sitewatch.monitor.tracker.AvailabilityTracker;
import com.sitewatch.service.api.ApiServer;
import com.sitewatch.service.api.DiagnosticsTracker;
import com.sitewatch.service.config.MonitorConfig;
import com.sitewatch.service.discord.DiscordDeliveryChannel;
import com.sitewatch.service.http.HttpClientFactory;
import com.sitewatch.service.store.SqliteSubscriberStore;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Wires the engine together from a validated configuration.
 */
public final class SiteWatchRuntime {
    private static final Logger LOGGER = Logger.getLogger(SiteWatchRuntime.class.getName());
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final SqliteSubscriberStore subscriberStore;
    private final AvailabilityTracker tracker;
    private final MonitorLoop monitorLoop;
    private final DiagnosticsTracker diagnosticsTracker;
    private final ApiServer apiServer;

    private SiteWatchRuntime(
            SqliteSubscriberStore subscriberStore,
            AvailabilityTracker tracker,
            MonitorLoop monitorLoop,
            DiagnosticsTracker diagnosticsTracker,
            ApiServer apiServer
    ) {
        this.subscriberStore = subscriberStore;
        this.tracker = tracker;
        this.monitorLoop = monitorLoop;
        this.diagnosticsTracker = diagnosticsTracker;
        this.apiServer = apiServer;
    }

    public static SiteWatchRuntime assemble(MonitorConfig config) {
        HttpClient httpClient = HttpClientFactory.create(CONNECT_TIMEOUT);
        DeliveryChannel discord = new DiscordDeliveryChannel(httpClient, config.botToken(), config.probeTimeout());
        return assemble(config, Clock.systemUTC(), httpClient, discord);
    }

    /**
     * @throws com.sitewatch.monitor.api.StorageInitException if the subscriber database cannot be initialized
     */
    public static SiteWatchRuntime assemble(
            MonitorConfig config,
            Clock clock,
            HttpClient httpClient,
            DeliveryChannel deliveryChannel
    ) {
        SqliteSubscriberStore store = new SqliteSubscriberStore(config.databasePath(), config.maxSubscribers());
        store.ensureInitialized();

        EventBus eventBus = new EventBus();
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock);
        AvailabilityTracker tracker = new AvailabilityTracker(config.urlsToCheck());
        NotificationDispatcher dispatcher = new NotificationDispatcher(
                store,
                deliveryChannel,
                eventBus,
                clock,
                config.deliveryConcurrency()
        );
        MonitorLoop loop = new MonitorLoop(
                tracker,
                new HttpUrlProbe(httpClient, config.probeTimeout(), clock),
                dispatcher,
                config.notificationPolicy(),
                eventBus,
                clock,
                config.urlCheckDelay()
        );
        ApiServer api = config.apiEnabled()
                ? new ApiServer(config.apiPort(), store, tracker, config.notificationPolicy(), diagnostics)
                : null;
        return new SiteWatchRuntime(store, tracker, loop, diagnostics, api);
    }

    public void start() {
        if (apiServer != null) {
            apiServer.start();
        } else {
            LOGGER.info("api_port is 0; HTTP API disabled.");
        }
        monitorLoop.start();
    }

    public void stop() {
        monitorLoop.shutdown();
        if (apiServer != null) {
            apiServer.stop();
        }
    }

    public SqliteSubscriberStore subscriberStore() {
        return subscriberStore;
    }

    public AvailabilityTracker tracker() {
        return tracker;
    }

    public MonitorLoop monitorLoop() {
        return monitorLoop;
    }

    public DiagnosticsTracker diagnostics() {
        return diagnosticsTracker;
    }
}
