package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record QuestionResponse(FanOutTag tag, String answer, String error) implements WorkerResponse {
}
