package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.CommunityAnalysis;
import me.golemcore.estate.domain.model.FanOutTag;

public record CommunityResponse(FanOutTag tag, CommunityAnalysis analysis, String error) implements WorkerResponse {
}
