package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.SearchResult;

public record SearchResponse(FanOutTag tag, SearchResult result, String error) implements WorkerResponse {
}
