package me.golemcore.estate.infrastructure.http;

import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.testsupport.http.RoutedHttpEngine;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OkHttpConfigTest {

    private EstateProperties properties;
    private RoutedHttpEngine engine;

    @BeforeEach
    void setUp() {
        properties = new EstateProperties();
        engine = new RoutedHttpEngine();
    }

    @Test
    void shouldApplyConfiguredTimeouts() {
        properties.getHttp().setConnectTimeout(1500);
        properties.getHttp().setReadTimeout(7000);

        OkHttpClient client = new OkHttpConfig(properties).okHttpClient();

        assertEquals(1500, client.connectTimeoutMillis());
        assertEquals(7000, client.readTimeoutMillis());
    }

    @Test
    void shouldSendServiceUserAgent() throws IOException {
        engine.on("/geocode").json(200, "{}");

        try (Response response = routedClient().newCall(new Request.Builder()
                .url("https://api.test/geocode?access_token=secret").build()).execute()) {
            assertEquals(200, response.code());
        }

        assertEquals(OkHttpConfig.USER_AGENT, engine.exchanges().get(0).headers().get("User-Agent"));
    }

    @Test
    void shouldKeepExplicitUserAgent() throws IOException {
        engine.on("/request").json(200, "{}");

        try (Response response = routedClient().newCall(new Request.Builder()
                .url("https://api.test/request")
                .header("User-Agent", "Mozilla/5.0")
                .build()).execute()) {
            assertEquals(200, response.code());
        }

        assertEquals("Mozilla/5.0", engine.exchanges().get(0).headers().get("User-Agent"));
    }

    @Test
    void shouldPropagateTransportFailures() {
        engine.on("/search").fail(new IOException("connection reset"));

        IOException failure = assertThrows(IOException.class, () -> routedClient().newCall(new Request.Builder()
                .url("https://api.test/search").build()).execute());

        assertEquals("connection reset", failure.getMessage());
    }

    private OkHttpClient routedClient() {
        return new OkHttpConfig(properties).okHttpClient().newBuilder()
                .addInterceptor(engine)
                .build();
    }
}
