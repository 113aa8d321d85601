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

import lombok.RequiredArgsConstructor;
import me.golemcore.estate.domain.model.CommunityAnalysis;
import me.golemcore.estate.domain.model.EnrichedListing;
import me.golemcore.estate.domain.model.Listing;
import me.golemcore.estate.domain.model.NewsStory;
import me.golemcore.estate.domain.model.PointOfInterest;
import me.golemcore.estate.domain.model.SearchResult;
import me.golemcore.estate.domain.model.TurnSnapshot;
import me.golemcore.estate.infrastructure.config.EstateProperties;
import me.golemcore.estate.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the final answer of a search turn as markdown. Headings and labels
 * come from the message bundles of the current language.
 */
@Component
@RequiredArgsConstructor
public class ResultMessageRenderer {

    private static final String SEPARATOR = "---\n\n";
    private static final int MAX_STORIES = 3;

    private final StaticMapUrlBuilder staticMapUrlBuilder;
    private final EstateProperties properties;
    private final MessageService messageService;

    public String render(TurnSnapshot snapshot, List<EnrichedListing> listings) {
        StringBuilder sb = new StringBuilder();
        SearchResult result = snapshot.searchResult();

        sb.append(msg("result.title")).append("\n\n");
        if (result != null && result.getSummary() != null && !result.getSummary().isBlank()) {
            sb.append("**").append(result.getSummary().trim()).append("**\n\n");
        }
        int found = result != null ? Math.max(result.getTotalFound(), listings.size()) : 0;
        sb.append(msg("result.found", String.valueOf(found))).append("\n\n");

        staticMapUrlBuilder.build(listings).ifPresent(url -> {
            sb.append(msg("result.map.heading")).append("\n\n");
            sb.append("![").append(msg("result.map.alt")).append("](").append(url).append(")\n\n");
            sb.append(msg("result.map.caption")).append("\n\n");
        });

        if (listings.isEmpty()) {
            sb.append(msg("turn.search.empty")).append("\n\n");
        } else {
            sb.append(SEPARATOR);
        }
        for (EnrichedListing listing : listings) {
            appendListing(sb, listing);
        }

        if (snapshot.communityAnalysis() != null) {
            appendCommunity(sb, snapshot.communityAnalysis());
        }
        if (snapshot.partial()) {
            sb.append(msg("result.partial")).append("\n");
        }
        return sb.toString().trim();
    }

    private void appendListing(StringBuilder sb, EnrichedListing enriched) {
        Listing listing = enriched.getListing();
        sb.append(msg("result.property", String.valueOf(enriched.getIndex() + 1))).append("\n\n");

        if (hasText(listing.getTitle())) {
            sb.append("### 📍 ").append(listing.getTitle()).append("\n\n");
        }
        if (hasText(enriched.getImageUrl())) {
            sb.append("![").append(msg("result.image.alt")).append("](").append(enriched.getImageUrl())
                    .append(")\n\n");
        }
        if (hasText(listing.getPrice())) {
            sb.append(msg("result.price", listing.getPrice())).append("\n\n");
        }

        List<String> details = new ArrayList<>();
        if (hasText(listing.getBeds())) {
            details.add(msg("result.beds", listing.getBeds()));
        }
        if (hasText(listing.getBaths())) {
            details.add(msg("result.baths", listing.getBaths()));
        }
        if (hasText(listing.getSqft())) {
            details.add(msg("result.sqft", listing.getSqft()));
        }
        if (!details.isEmpty()) {
            sb.append(msg("result.details", String.join(" | ", details))).append("\n\n");
        }

        if (hasText(enriched.getResolvedAddress())) {
            sb.append(msg("result.address", enriched.getResolvedAddress())).append("\n\n");
        }
        if (enriched.hasCoordinates()) {
            sb.append(msg("result.coordinates", String.valueOf(enriched.getLatitude()),
                    String.valueOf(enriched.getLongitude()))).append("\n\n");
        }
        appendPointsOfInterest(sb, enriched.getPointsOfInterest());

        if (hasText(listing.getLink())) {
            sb.append(msg("result.link", listing.getLink())).append("\n\n");
        }
        sb.append(SEPARATOR);
    }

    private void appendPointsOfInterest(StringBuilder sb, List<PointOfInterest> points) {
        if (points == null || points.isEmpty()) {
            return;
        }
        int limit = Math.max(0, properties.getTurn().getPoiDisplayLimit());
        if (limit == 0) {
            return;
        }
        sb.append(msg("result.nearby")).append("\n");
        points.stream().limit(limit).forEach(poi -> {
            sb.append("- ").append(poi.getName());
            if (hasText(poi.getCategory())) {
                sb.append(" (").append(poi.getCategory().replace('_', ' ')).append(")");
            }
            if (poi.getDistanceMeters() != null) {
                String meters = String.valueOf(Math.round(poi.getDistanceMeters()));
                sb.append(" - ").append(msg("result.poi.distance", meters));
            }
            sb.append("\n");
        });
        sb.append("\n");
    }

    private void appendCommunity(StringBuilder sb, CommunityAnalysis community) {
        sb.append(msg("community.heading", community.getLocation())).append("\n\n");
        if (community.getOverallScore() != null) {
            sb.append(msg("community.overall", formatNumber(community.getOverallScore()))).append("\n\n");
        }
        if (hasText(community.getOverallExplanation())) {
            sb.append(msg("community.overview", community.getOverallExplanation())).append("\n\n");
        }
        if (community.getSafetyScore() != null) {
            sb.append(msg("community.safety", formatNumber(community.getSafetyScore()))).append("\n\n");
        }
        if (community.getSchoolScore() != null) {
            sb.append(msg("community.school", formatNumber(community.getSchoolScore()))).append("\n");
            if (hasText(community.getSchoolExplanation())) {
                sb.append("   *").append(community.getSchoolExplanation()).append("*\n");
            }
            sb.append("\n");
        }
        if (community.getHousingPricePerSqft() != null) {
            sb.append(msg("community.price", formatNumber(community.getHousingPricePerSqft()))).append("\n\n");
        }
        if (community.getAvgHouseSizeSqft() != null) {
            sb.append(msg("community.size", formatNumber(community.getAvgHouseSizeSqft()))).append("\n\n");
        }
        appendStories(sb, msg("community.positive"), community.getPositiveStories());
        appendStories(sb, msg("community.negative"), community.getNegativeStories());
    }

    private void appendStories(StringBuilder sb, String heading, List<NewsStory> stories) {
        if (stories == null || stories.isEmpty()) {
            return;
        }
        sb.append(heading).append("\n\n");
        stories.stream().limit(MAX_STORIES).forEach(story -> {
            sb.append("- **").append(hasText(story.title()) ? story.title() : msg("community.story.untitled"))
                    .append("**\n");
            if (hasText(story.summary())) {
                sb.append("  ").append(story.summary()).append("\n");
            }
            if (hasText(story.url())) {
                sb.append("  ").append(msg("community.story.more", story.url())).append("\n");
            }
            sb.append("\n");
        });
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
