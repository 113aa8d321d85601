package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

public record QuestionRequest(FanOutTag tag, String question) implements WorkerMessage {
}
