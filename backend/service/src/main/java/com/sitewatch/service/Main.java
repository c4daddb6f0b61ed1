package com.sitewatch.service;

import com.sitewatch.monitor.api.StorageInitException;
import com.sitewatch.service.config.ConfigException;
import com.sitewatch.service.config.ConfigLoader;
import com.sitewatch.service.config.MonitorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();

        MonitorConfig config;
        SiteWatchRuntime runtime;
        try {
            config = ConfigLoader.load(configPath(args));
            runtime = SiteWatchRuntime.assemble(config);
        } catch (ConfigException | StorageInitException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e.getCause());
            System.exit(1);
            return;
        }
        LOGGER.info("Starting with " + config);

        runtime.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static Path configPath(String[] args) {
        if (args.length > 0 && !args[0].isBlank()) {
            return Path.of(args[0]);
        }
        return ConfigLoader.DEFAULT_PATH;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not read bundled logging.properties", e);
        }
    }
}
