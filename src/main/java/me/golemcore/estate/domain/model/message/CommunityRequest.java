package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record CommunityRequest(FanOutTag tag, String locationName) implements WorkerMessage {
}
