package me.golemcore.estate.adapter.outbound.mapbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.estate.domain.model.PointOfInterest;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.http.FeignClientFactory;
import me.golemcore.estate.testsupport.http.RoutedHttpEngine;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapboxPoiAdapterTest {

    private static final String CATEGORY_PATH = "/search/searchbox/v1/category/";

    private RoutedHttpEngine engine;
    private EstateProperties properties;
    private MapboxPoiAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new RoutedHttpEngine();
        properties = new EstateProperties();
        properties.getMapbox().setAccessToken("pk.test");
        properties.getMapbox().setPoiCategories(List.of("school", "park"));
        FeignClientFactory factory = new FeignClientFactory(engine.client(), new ObjectMapper());
        adapter = new MapboxPoiAdapter(factory.create(MapboxApi.class, "http://mapbox.test"), properties);
    }

    @Test
    void shouldCollectPlacesPerCategory() {
        engine.on(CATEGORY_PATH + "school").json(200, """
                {"features": [
                  {"geometry": {"coordinates": [-122.251, 37.845]},
                   "properties": {"name": "Chabot Elementary", "full_address": "6686 Chabot Rd, Oakland", "distance": 412.5}}
                ]}
                """);
        engine.on(CATEGORY_PATH + "park").json(200, """
                {"features": [
                  {"geometry": {"coordinates": [-122.249, 37.842]},
                   "properties": {"name": "Rockridge Park", "place_formatted": "Oakland, California"}},
                  {"geometry": {}, "properties": {"name": "Broken"}}
                ]}
                """);

        List<PointOfInterest> points = adapter.findNearby(37.8437, -122.2508).join();

        assertEquals(2, points.size());
        PointOfInterest school = points.get(0);
        assertEquals("Chabot Elementary", school.getName());
        assertEquals("school", school.getCategory());
        assertEquals(37.845, school.getLatitude(), 0.00001);
        assertEquals(-122.251, school.getLongitude(), 0.00001);
        assertEquals(412.5, school.getDistanceMeters(), 0.0001);
        assertEquals("6686 Chabot Rd, Oakland", school.getAddress());

        PointOfInterest park = points.get(1);
        assertEquals("Oakland, California", park.getAddress());
        assertNull(park.getDistanceMeters());

        HttpUrl url = HttpUrl.get(engine.exchangesTo(CATEGORY_PATH + "school").get(0).url());
        assertEquals("-122.2508,37.8437", url.queryParameter("proximity"));
        assertEquals("2", url.queryParameter("limit"));
    }

    @Test
    void shouldSkipFailingCategory() {
        engine.on(CATEGORY_PATH + "school").json(500, "{}");
        engine.on(CATEGORY_PATH + "park").json(200, """
                {"features": [{"geometry": {"coordinates": [-122.249, 37.842]}, "properties": {"name": "Rockridge Park"}}]}
                """);

        List<PointOfInterest> points = adapter.findNearby(37.8437, -122.2508).join();

        assertEquals(1, points.size());
        assertEquals("park", points.get(0).getCategory());
    }

    @Test
    void shouldFailWithoutToken() {
        properties.getMapbox().setAccessToken(null);

        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.findNearby(37.8, -122.2).join());
        assertEquals("Mapbox token not configured", ex.getCause().getMessage());
        assertTrue(engine.exchanges().isEmpty());
    }
}
