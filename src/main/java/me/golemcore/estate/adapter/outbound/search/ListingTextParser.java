package me.golemcore.estate.adapter.outbound.search;

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

import me.golemcore.estate.domain.model.SearchRequirements;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts listing facts from search result snippets and scraped markdown.
 */
final class ListingTextParser {

    private static final Pattern PRICE = Pattern.compile("\\$\\s?\\d[\\d,]*(?:\\.\\d+)?(?:\\s?[KkMm]\\b)?");
    private static final Pattern BEDS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:bd|bds|beds?|bedrooms?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BATHS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:ba|baths?|bathrooms?)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SQFT = Pattern.compile("(\\d[\\d,]*)\\s*(?:sq\\.?\\s?ft|sqft|square feet)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[|\\u2013\\u2014-]\\s+");
    private static final Pattern MARKDOWN_IMAGE = Pattern.compile("!\\[[^\\]]*\\]\\((https?://[^)\\s]+)\\)");
    private static final List<String> IMAGE_SKIP_WORDS = List.of("icon", "logo", "avatar", "badge", "button");
    private static final List<String> IMAGE_SKIP_SIZES = List.of("16x16", "32x32", "48x48", "64x64");
    private static final List<String> SEARCH_WORDS = List.of("homes", "properties", "real estate");

    private ListingTextParser() {
    }

    /**
     * Renders search criteria as a web search query. Appends "homes for sale"
     * unless the text already names what is searched for.
     */
    static String toQuery(SearchRequirements requirements) {
        StringBuilder sb = new StringBuilder();
        if (requirements.getBedrooms() != null) {
            sb.append(requirements.getBedrooms()).append(" bedroom ");
        }
        if (requirements.getBathrooms() != null) {
            sb.append(formatBathrooms(requirements.getBathrooms())).append(" bathroom ");
        }
        if (hasText(requirements.getAdditionalInfo())) {
            sb.append(requirements.getAdditionalInfo().trim()).append(' ');
        }
        if (hasText(requirements.getLocation())) {
            sb.append("in ").append(requirements.getLocation().trim()).append(' ');
        }
        if (requirements.getBudgetMin() != null && requirements.getBudgetMax() != null) {
            sb.append("between $").append(requirements.getBudgetMin()).append(" and $")
                    .append(requirements.getBudgetMax()).append(' ');
        } else if (requirements.getBudgetMax() != null) {
            sb.append("under $").append(requirements.getBudgetMax()).append(' ');
        } else if (requirements.getBudgetMin() != null) {
            sb.append("over $").append(requirements.getBudgetMin()).append(' ');
        }
        String query = sb.toString().trim();
        String lower = query.toLowerCase(Locale.ROOT);
        if (SEARCH_WORDS.stream().noneMatch(lower::contains)) {
            query = query.isEmpty() ? "homes for sale" : query + " homes for sale";
        }
        return query;
    }

    /**
     * The address part of a listing page title such as
     * {@code "123 Main St, Oakland, CA 94610 | MLS# 1 | Redfin"}.
     */
    static String addressFromTitle(String title) {
        if (!hasText(title)) {
            return null;
        }
        String head = TITLE_SEPARATOR.split(title.trim(), 2)[0].trim();
        return head.isEmpty() ? null : head;
    }

    static String price(String text) {
        return firstMatch(PRICE, text, 0);
    }

    static String beds(String text) {
        return firstMatch(BEDS, text, 1);
    }

    static String baths(String text) {
        return firstMatch(BATHS, text, 1);
    }

    static String sqft(String text) {
        return firstMatch(SQFT, text, 1);
    }

    /**
     * First markdown image that does not look like an icon or logo.
     */
    static String firstPropertyImage(String markdown) {
        if (markdown == null) {
            return null;
        }
        Matcher matcher = MARKDOWN_IMAGE.matcher(markdown);
        while (matcher.find()) {
            String url = matcher.group(1);
            String lower = url.toLowerCase(Locale.ROOT);
            if (IMAGE_SKIP_WORDS.stream().anyMatch(lower::contains)
                    || IMAGE_SKIP_SIZES.stream().anyMatch(lower::contains)) {
                continue;
            }
            return url;
        }
        return null;
    }

    static boolean isListingSite(String url) {
        return url != null && (url.contains("redfin.com") || url.contains("zillow.com"));
    }

    private static String firstMatch(Pattern pattern, String text, int group) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(group).trim() : null;
    }

    private static String formatBathrooms(double bathrooms) {
        return bathrooms == Math.floor(bathrooms) ? String.valueOf((long) bathrooms) : String.valueOf(bathrooms);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
