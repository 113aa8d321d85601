package me.golemcore.estate.domain.model.message;

/**
 * Response of a worker. A non-null {@link #error()} means the request failed;
 * the response still counts as an arrival.
 */
public interface WorkerResponse extends WorkerMessage {

    String error();

    default boolean isError() {
        return error() != null;
    }
}
