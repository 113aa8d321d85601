package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record ScopingRequest(FanOutTag tag, String userMessage) implements WorkerMessage {
}
