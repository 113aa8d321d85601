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

import me.golemcore.estate.domain.model.message.CommunityRequest;
import me.golemcore.estate.domain.model.message.CommunityResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.CommunityAnalysisPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class CommunityAnalysisWorker extends AbstractWorker<CommunityRequest> {

    private final CommunityAnalysisPort communityAnalysisPort;

    public CommunityAnalysisWorker(SpringEventBus eventBus, CommunityAnalysisPort communityAnalysisPort) {
        super(eventBus);
        this.communityAnalysisPort = communityAnalysisPort;
    }

    @Override
    protected String getWorkerName() {
        return "Community";
    }

    @EventListener
    public void onRequest(CommunityRequest request) {
        respond(request,
                () -> communityAnalysisPort.analyze(request.locationName()),
                (tag, analysis) -> new CommunityResponse(tag, analysis, null),
                (tag, error) -> new CommunityResponse(tag, null, error));
    }
}
