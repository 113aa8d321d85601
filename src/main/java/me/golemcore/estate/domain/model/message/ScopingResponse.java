package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

/**
 * Raw classification produced by the scoping worker. The router parses
 * {@code payload}; an unparseable payload is not an error of the worker.
 */
public record ScopingResponse(FanOutTag tag, String payload, String error) implements WorkerResponse {
}
