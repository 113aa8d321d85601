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

import me.golemcore.estate.domain.model.message.SearchRequest;
import me.golemcore.estate.domain.model.message.SearchResponse;
import me.golemcore.estate.infrastructure.event.SpringEventBus;
import me.golemcore.estate.port.outbound.ListingSearchPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class ListingSearchWorker extends AbstractWorker<SearchRequest> {

    private final ListingSearchPort listingSearchPort;

    public ListingSearchWorker(SpringEventBus eventBus, ListingSearchPort listingSearchPort) {
        super(eventBus);
        this.listingSearchPort = listingSearchPort;
    }

    @Override
    protected String getWorkerName() {
        return "Search";
    }

    @EventListener
    public void onRequest(SearchRequest request) {
        respond(request,
                () -> listingSearchPort.search(request.requirements()),
                (tag, result) -> new SearchResponse(tag, result, null),
                (tag, error) -> new SearchResponse(tag, null, error));
    }
}
