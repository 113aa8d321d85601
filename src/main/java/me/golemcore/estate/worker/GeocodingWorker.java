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

import me.golemcore.estate.domain.model.message.GeocodeRequest;
import me.golemcore.estate.domain.model.message.GeocodeResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.GeocodingPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class GeocodingWorker extends AbstractWorker<GeocodeRequest> {

    private final GeocodingPort geocodingPort;

    public GeocodingWorker(SpringEventBus eventBus, GeocodingPort geocodingPort) {
        super(eventBus);
        this.geocodingPort = geocodingPort;
    }

    @Override
    protected String getWorkerName() {
        return "Geocode";
    }

    @EventListener
    public void onRequest(GeocodeRequest request) {
        respond(request,
                () -> geocodingPort.geocode(request.address()),
                GeocodeResponse::of,
                GeocodeResponse::failed);
    }
}
