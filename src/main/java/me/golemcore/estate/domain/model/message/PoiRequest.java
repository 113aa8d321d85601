package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record PoiRequest(FanOutTag tag, double latitude, double longitude) implements WorkerMessage {
}
