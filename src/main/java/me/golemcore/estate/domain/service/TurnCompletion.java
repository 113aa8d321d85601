package me.golemcore.estate.domain.service;

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

import me.golemcore.estate.domain.model.SearchSession;

/**
 * The completion predicate of a search turn. Every arrival handler and the
 * deadline sweep decide through this class; a turn is complete when the
 * search result is present, every dispatched geocode arrived, every cascaded
 * POI search arrived, and (optionally) the community analysis arrived.
 *
 * <p>
 * Zero-width stages are complete by construction: {@code 0 >= 0}.
 */
public final class TurnCompletion {

    private TurnCompletion() {
    }

    public static boolean isGeocodeStageComplete(SearchSession session) {
        return session.isGeocodeDispatched()
                && session.getArrivedGeocodeCount() >= session.getExpectedGeocodeCount();
    }

    /**
     * The POI stage only grows while geocodes arrive, so it cannot be complete
     * before the geocode stage is.
     */
    public static boolean isPoiStageComplete(SearchSession session) {
        return isGeocodeStageComplete(session)
                && session.getArrivedPoiCount() >= session.getExpectedPoiCount();
    }

    public static boolean isCommunitySettled(SearchSession session, boolean waitForCommunity) {
        return !waitForCommunity || !session.isCommunityRequested() || session.isCommunityArrived();
    }

    public static boolean isTurnComplete(SearchSession session, boolean waitForCommunity) {
        return session.getSearchResult() != null
                && isPoiStageComplete(session)
                && isCommunitySettled(session, waitForCommunity);
    }
}
