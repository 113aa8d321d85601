package me.golemcore.estate.adapter.outbound.search;

import me.golemcore.estate.domain.model.SearchRequirements;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ListingTextParserTest {

    @Test
    void shouldRenderFullQuery() {
        SearchRequirements requirements = SearchRequirements.builder()
                .budgetMin(800_000L)
                .budgetMax(1_200_000L)
                .bedrooms(3)
                .bathrooms(2.5)
                .location("Oakland")
                .build();

        assertEquals("3 bedroom 2.5 bathroom in Oakland between $800000 and $1200000 homes for sale",
                ListingTextParser.toQuery(requirements));
    }

    @Test
    void shouldNotAppendSuffixWhenQueryNamesHomes() {
        SearchRequirements requirements = SearchRequirements.builder()
                .bathrooms(2.0)
                .additionalInfo("craftsman homes with a yard")
                .location("Berkeley")
                .budgetMax(900_000L)
                .build();

        assertEquals("2 bathroom craftsman homes with a yard in Berkeley under $900000",
                ListingTextParser.toQuery(requirements));
    }

    @Test
    void shouldFallBackToGenericQuery() {
        assertEquals("homes for sale", ListingTextParser.toQuery(new SearchRequirements()));
    }

    @Test
    void shouldTakeAddressFromTitleHead() {
        assertEquals("123 Main St, Oakland, CA 94610",
                ListingTextParser.addressFromTitle("123 Main St, Oakland, CA 94610 | MLS# 4 | Redfin"));
        assertEquals("42 Elm Ave", ListingTextParser.addressFromTitle("42 Elm Ave - Zillow"));
        assertEquals("Well-Kept Home", ListingTextParser.addressFromTitle("Well-Kept Home"));
        assertNull(ListingTextParser.addressFromTitle("  "));
    }

    @Test
    void shouldExtractFacts() {
        String text = "Listed at $1.2M more or less: 4 bds, 3 ba, 2,100 sqft";

        assertEquals("$1.2M", ListingTextParser.price(text));
        assertEquals("$850,000", ListingTextParser.price("only $850,000 more"));
        assertEquals("4", ListingTextParser.beds(text));
        assertEquals("3", ListingTextParser.baths(text));
        assertEquals("2,100", ListingTextParser.sqft(text));
        assertNull(ListingTextParser.beds("studio"));
    }

    @Test
    void shouldSkipIconsWhenPickingImage() {
        String markdown = """
                ![](https://cdn.test/icons/star.svg)
                ![thumb](https://cdn.test/img_32x32.png)
                ![living room](https://photos.test/house/1.jpg)
                """;

        assertEquals("https://photos.test/house/1.jpg", ListingTextParser.firstPropertyImage(markdown));
        assertNull(ListingTextParser.firstPropertyImage("![logo](https://cdn.test/logo.png)"));
        assertNull(ListingTextParser.firstPropertyImage(null));
    }

    @Test
    void shouldRecognizeListingSites() {
        assertTrue(ListingTextParser.isListingSite("https://www.zillow.com/homedetails/1"));
        assertTrue(ListingTextParser.isListingSite("https://www.redfin.com/CA/1"));
        assertFalse(ListingTextParser.isListingSite("https://www.trulia.com/1"));
        assertFalse(ListingTextParser.isListingSite(null));
    }
}
