package me.golemcore.estate.adapter.outbound.mapbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.estate.domain.model.GeocodeResult;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.http.FeignClientFactory;
import me.golemcore.estate.testsupport.http.RoutedHttpEngine;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapboxGeocodingAdapterTest {

    private static final String FORWARD_PATH = "/search/geocode/v6/forward";

    private RoutedHttpEngine engine;
    private EstateProperties properties;
    private MapboxGeocodingAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new RoutedHttpEngine();
        properties = new EstateProperties();
        properties.getMapbox().setAccessToken("pk.test");
        FeignClientFactory factory = new FeignClientFactory(engine.client(), new ObjectMapper());
        MapboxApi api = factory.create(MapboxApi.class, "http://mapbox.test");
        adapter = new MapboxGeocodingAdapter(api, properties);
    }

    @Test
    void shouldResolveTopFeature() {
        engine.on(FORWARD_PATH).json(200, """
                {"features": [
                  {"geometry": {"coordinates": [-122.2508, 37.8437]},
                   "properties": {"full_address": "5800 Broadway Terrace, Oakland, California 94618, United States"}},
                  {"geometry": {"coordinates": [0.0, 0.0]}, "properties": {}}
                ]}
                """);

        GeocodeResult result = adapter.geocode("5800 Broadway Ter, Oakland, CA 94618").join();

        assertTrue(result.isSuccess());
        assertEquals(37.8437, result.latitude(), 0.00001);
        assertEquals(-122.2508, result.longitude(), 0.00001);
        assertEquals("5800 Broadway Terrace, Oakland, California 94618, United States", result.resolvedAddress());

        HttpUrl url = HttpUrl.get(engine.exchangesTo(FORWARD_PATH).get(0).url());
        assertEquals("5800 Broadway Ter, Oakland, CA 94618", url.queryParameter("q"));
        assertEquals("1", url.queryParameter("limit"));
        assertEquals("US", url.queryParameter("country"));
        assertEquals("pk.test", url.queryParameter("access_token"));
    }

    @Test
    void shouldFallBackToInputAddressWhenFullAddressMissing() {
        engine.on(FORWARD_PATH).json(200, """
                {"features": [{"geometry": {"coordinates": [-122.27, 37.80]}, "properties": {}}]}
                """);

        GeocodeResult result = adapter.geocode("Lake Merritt").join();

        assertTrue(result.isSuccess());
        assertEquals("Lake Merritt", result.resolvedAddress());
    }

    @Test
    void shouldReportMissingCoordinates() {
        engine.on(FORWARD_PATH).json(200, "{\"features\": []}");

        GeocodeResult result = adapter.geocode("nowhere 00000").join();

        assertFalse(result.isSuccess());
        assertEquals("No coordinates found for address", result.error());
    }

    @Test
    void shouldReportHttpErrorAsFailedResult() {
        engine.on(FORWARD_PATH).json(401, "{\"message\": \"Not Authorized - Invalid Token\"}");

        GeocodeResult result = adapter.geocode("1 Main St").join();

        assertFalse(result.isSuccess());
        assertEquals("Mapbox geocoding failed: HTTP 401", result.error());
    }

    @Test
    void shouldNotCallMapboxWithoutTokenOrAddress() {
        assertEquals("Address is blank", adapter.geocode(" ").join().error());

        properties.getMapbox().setAccessToken("");
        assertEquals("Mapbox token not configured", adapter.geocode("1 Main St").join().error());

        assertTrue(engine.exchanges().isEmpty());
    }
}
