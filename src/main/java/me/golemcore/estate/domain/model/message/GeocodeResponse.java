package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.GeocodeResult;

public record GeocodeResponse(FanOutTag tag, Double latitude, Double longitude, String resolvedAddress,
        String error) implements WorkerResponse {

    public static GeocodeResponse of(FanOutTag tag, GeocodeResult result) {
        return new GeocodeResponse(tag, result.latitude(), result.longitude(), result.resolvedAddress(),
                result.isSuccess() ? null : result.error());
    }

    public static GeocodeResponse failed(FanOutTag tag, String error) {
        return new GeocodeResponse(tag, null, null, null, error);
    }
}
