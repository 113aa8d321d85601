package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record GeocodeRequest(FanOutTag tag, String address) implements WorkerMessage {
}
