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

import me.golemcore.estate.domain.model.message.ScopingRequest;
import me.golemcore.estate.domain.model.message.ScopingResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.ScopingPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Classifies user messages through the {@link ScopingPort}.
 */
@Component
public class ScopingWorker extends AbstractWorker<ScopingRequest> {

    private final ScopingPort scopingPort;

    public ScopingWorker(SpringEventBus eventBus, ScopingPort scopingPort) {
        super(eventBus);
        this.scopingPort = scopingPort;
    }

    @Override
    protected String getWorkerName() {
        return "Scoping";
    }

    @EventListener
    public void onRequest(ScopingRequest request) {
        respond(request,
                () -> scopingPort.classify(request.tag().sessionKey(), request.userMessage()),
                (tag, payload) -> new ScopingResponse(tag, payload, null),
                (tag, error) -> new ScopingResponse(tag, null, error));
    }
}
