package me.golemcore.estate.domain.model.message;

import me.golemcore.estate.domain.model.FanOutTag;

/**
 * Message exchanged between the coordinator and a worker over the bus.
 */
public interface WorkerMessage {

    FanOutTag tag();
}
