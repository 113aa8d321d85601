package me.golemcore.estate.infrastructure.event;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.estate.domain.model.message.WorkerMessage;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Message bus between the coordinator and the workers, built on Spring's
 * ApplicationEventPublisher.
 *
 * <p>
 * Events are delivered synchronously to all registered {@code @EventListener}
 * methods. Workers hand their backend calls to futures, so a publish returns as
 * soon as the request is accepted and the response is published later from the
 * completing thread.
 *
 * <p>
 * Usage:
 *
 * <pre>{@code
 * eventBus.publish(new GeocodeRequest(tag, address));
 * }</pre>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    /**
     * Publish an event.
     */
    public void publish(Object event) {
        if (event instanceof WorkerMessage message) {
            log.debug("Publishing {} ({})", event.getClass().getSimpleName(), message.tag());
        } else {
            log.debug("Publishing event: {}", event.getClass().getSimpleName());
        }
        eventPublisher.publishEvent(event);
    }

    /**
     * Publish a batch of messages in order.
     */
    public void publishAll(List<? extends WorkerMessage> messages) {
        for (WorkerMessage message : messages) {
            publish(message);
        }
    }
}
