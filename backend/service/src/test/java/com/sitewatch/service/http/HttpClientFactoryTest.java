package com.sitewatch.service.http;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @Test
    void leavesRedirectsToTheCallerAndKeepsConnectTimeout() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/old", exchange -> {
            exchange.getResponseHeaders().add("Location", "/new");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/new", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        try {
            HttpClient client = HttpClientFactory.create(Duration.ofMillis(750), Map.of());
            URI old = URI.create("http://localhost:" + server.getAddress().getPort() + "/old");

            HttpResponse<Void> response = client.send(
                    HttpRequest.newBuilder(old).method("HEAD", HttpRequest.BodyPublishers.noBody()).build(),
                    HttpResponse.BodyHandlers.discarding()
            );

            assertEquals(301, response.statusCode());
            assertTrue(response.uri().getPath().endsWith("/old"));
            assertEquals(Duration.ofMillis(750), client.connectTimeout().orElseThrow());
        } finally {
            server.stop(0);
        }
    }

    @Test
    void blankTruststorePathUsesDefaultTrust() {
        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(1), Map.of("TRUSTSTORE_PATH", "  "));

        assertEquals(HttpClient.Redirect.NEVER, client.followRedirects());
    }

    @Test
    void truststoreWithoutPasswordIsRejected() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofSeconds(1), Map.of("TRUSTSTORE_PATH", "/tmp/any.jks"))
        );

        assertTrue(ex.getMessage().contains("TRUSTSTORE_PASSWORD"));
    }

    @Test
    void missingTruststoreFileIsRejected() {
        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                        "TRUSTSTORE_PATH", "/tmp/site-watch-missing-truststore.jks",
                        "TRUSTSTORE_PASSWORD", "changeit"
                ))
        );

        assertTrue(ex.getMessage().contains("Truststore file does not exist"));
    }

    @Test
    void loadsPkcs12TruststoreByExtension() throws Exception {
        Path truststore = Files.createTempFile("site-watch-trust-", ".p12");
        writeEmptyTruststore(truststore, "PKCS12", "changeit".toCharArray());

        HttpClient client = HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                "TRUSTSTORE_PATH", truststore.toString(),
                "TRUSTSTORE_PASSWORD", "changeit"
        ));

        assertEquals(HttpClient.Redirect.NEVER, client.followRedirects());
    }

    @Test
    void wrongTruststorePasswordIsRejected() throws Exception {
        Path truststore = Files.createTempFile("site-watch-trust-", ".jks");
        writeEmptyTruststore(truststore, "JKS", "right".toCharArray());

        IllegalStateException ex = assertThrows(
                IllegalStateException.class,
                () -> HttpClientFactory.create(Duration.ofSeconds(1), Map.of(
                        "TRUSTSTORE_PATH", truststore.toString(),
                        "TRUSTSTORE_PASSWORD", "wrong"
                ))
        );

        assertTrue(ex.getMessage().contains(truststore.toString()));
    }

    private static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}
