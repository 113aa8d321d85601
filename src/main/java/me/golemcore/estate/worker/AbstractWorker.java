package me.golemcore.estate.worker;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.FanOutTag;
import me.golemcore.estate.domain.model.message.WorkerMessage;
import me.golemcore.estate.domain.model.message.WorkerResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Base class for bus workers. A worker receives a request, calls its backend
 * port and publishes exactly one response carrying the request's tag. Backend
 * failures become error responses instead of being dropped, so the
 * coordinator's arrival counters always advance.
 *
 * @param <Q>
 *            request type
 */
@Slf4j
public abstract class AbstractWorker<Q extends WorkerMessage> {

    private final SpringEventBus eventBus;

    protected AbstractWorker(SpringEventBus eventBus) {
        this.eventBus = eventBus;
    }

    protected abstract String getWorkerName();

    protected <T> void respond(Q request, Supplier<CompletableFuture<T>> call,
            BiFunction<FanOutTag, T, WorkerResponse> onSuccess,
            BiFunction<FanOutTag, String, WorkerResponse> onFailure) {
        FanOutTag tag = request.tag();
        log.debug("[{}] handling {}", getWorkerName(), tag);
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((value, failure) -> {
            WorkerResponse response;
            if (failure != null) {
                String error = describe(failure);
                log.warn("[{}] {} failed: {}", getWorkerName(), tag, error);
                response = onFailure.apply(tag, error);
            } else {
                response = onSuccess.apply(tag, value);
            }
            publish(response);
        });
    }

    private void publish(WorkerResponse response) {
        try {
            eventBus.publish(response);
        } catch (RuntimeException e) {
            log.error("[{}] failed to publish response {}: {}", getWorkerName(), response.tag(), e.getMessage(), e);
        }
    }

    static String describe(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }
}
