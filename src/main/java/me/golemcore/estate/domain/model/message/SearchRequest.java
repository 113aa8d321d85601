package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.SearchRequirements;

public record SearchRequest(FanOutTag tag, SearchRequirements requirements) implements WorkerMessage {
}
