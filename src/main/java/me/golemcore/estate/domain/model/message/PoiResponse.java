package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.PointOfInterest;

import java.util.List;

public record PoiResponse(FanOutTag tag, List<PointOfInterest> points, String error) implements WorkerResponse {

    public List<PointOfInterest> points() {
        return points != null ? points : List.of();
    }
}
