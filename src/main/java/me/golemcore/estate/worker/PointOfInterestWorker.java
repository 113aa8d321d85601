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

import me.golemcore.estate.domain.model.message.PoiRequest;
import me.golemcore.estate.domain.model.message.PoiResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.PointOfInterestPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PointOfInterestWorker extends AbstractWorker<PoiRequest> {

    private final PointOfInterestPort pointOfInterestPort;

    public PointOfInterestWorker(SpringEventBus eventBus, PointOfInterestPort pointOfInterestPort) {
        super(eventBus);
        this.pointOfInterestPort = pointOfInterestPort;
    }

    @Override
    protected String getWorkerName() {
        return "POI";
    }

    @EventListener
    public void onRequest(PoiRequest request) {
        respond(request,
                () -> pointOfInterestPort.findNearby(request.latitude(), request.longitude()),
                (tag, points) -> new PoiResponse(tag, points, null),
                (tag, error) -> new PoiResponse(tag, List.of(), error));
    }
}
