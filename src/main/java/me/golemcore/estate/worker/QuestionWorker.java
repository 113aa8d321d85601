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

import me.golemcore.estate.domain.model.message.QuestionRequest;
import me.golemcore.estate.domain.model.message.QuestionResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.QuestionAnsweringPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Answers general real-estate questions through the
 * {@link QuestionAnsweringPort}.
 */
@Component
public class QuestionWorker extends AbstractWorker<QuestionRequest> {

    private final QuestionAnsweringPort questionAnsweringPort;

    public QuestionWorker(SpringEventBus eventBus, QuestionAnsweringPort questionAnsweringPort) {
        super(eventBus);
        this.questionAnsweringPort = questionAnsweringPort;
    }

    @Override
    protected String getWorkerName() {
        return "Question";
    }

    @EventListener
    public void onRequest(QuestionRequest request) {
        respond(request,
                () -> questionAnsweringPort.answer(request.question()),
                (tag, answer) -> new QuestionResponse(tag, answer, null),
                (tag, error) -> new QuestionResponse(tag, null, error));
    }
}
