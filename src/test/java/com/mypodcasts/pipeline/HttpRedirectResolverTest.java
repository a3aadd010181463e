package com.mypodcasts.pipeline;

import com.mypodcasts.config.ProcessorConfig;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HttpRedirectResolverTest {

    private static HttpServer mockServer;
    private static String baseUrl;
    private static final AtomicReference<String> userAgent = new AtomicReference<>();

    @BeforeAll
    static void beforeAll() throws IOException {
        // Start mock HTTP server.
        mockServer = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        baseUrl = "http://127.0.0.1:" + mockServer.getAddress().getPort();

        mockServer.createContext("/absolute", exchange -> {
            userAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
            exchange.getResponseHeaders().add("Location", "https://www.slowboring.com/p/post?utm=1");
            exchange.sendResponseHeaders(302, -1);
            exchange.close();
        });

        mockServer.createContext("/relative", exchange -> {
            exchange.getResponseHeaders().add("Location", "/final");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });

        mockServer.createContext("/final", exchange -> {
            byte[] body = "done".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });

        mockServer.start();
    }

    @AfterAll
    static void afterAll() {
        if (mockServer != null) {
            mockServer.stop(0);
        }
    }

    private final HttpRedirectResolver resolver = new HttpRedirectResolver(
            new ProcessorConfig(Map.of("redirect", Map.of("timeout", 2.0, "userAgent", "resolver-test"))));

    @Test
    @DisplayName("Absolute location is returned as is")
    void absolute() {
        assertEquals(Optional.of("https://www.slowboring.com/p/post?utm=1"), resolver.resolveOnce(baseUrl + "/absolute"));
        assertEquals("resolver-test", userAgent.get());
    }

    @Test
    @DisplayName("Relative location is joined with the request origin and not followed")
    void relative() {
        assertEquals(Optional.of(baseUrl + "/final"), resolver.resolveOnce(baseUrl + "/relative"));
    }

    @Test
    @DisplayName("No location means no redirect")
    void noRedirect() {
        assertTrue(resolver.resolveOnce(baseUrl + "/final").isEmpty());
    }

    @Test
    @DisplayName("Failures mean no redirect")
    void failures() {
        assertTrue(resolver.resolveOnce("not a url").isEmpty());
        assertTrue(resolver.resolveOnce("http://127.0.0.1:1/closed").isEmpty());
    }
}
