package com.dealwatch.filter;

import com.dealwatch.model.OfferRecord;
import com.dealwatch.state.SeenSet;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordFiltersTest {

    private static final List<String> KEYWORDS = List.of("kindle", "ereader", "e-reader", "e-ink", "kobo", "nook", "eink");

    private final KeywordMatcher matcher = new KeywordMatcher(KEYWORDS);
    private final Prefilter prefilter = new Prefilter(matcher);
    private final MatchFilter matchFilter = new MatchFilter(matcher);

    @Test
    void paperwhiteTitleShouldPassBothFilters() {
        OfferRecord record = offer("1", "Kindle Paperwhite 8GB", Map.of());

        assertTrue(prefilter.matches(record));
        assertTrue(matchFilter.isMatch(record));
        assertEquals(new KeywordMatcher.Hit("Title", "kindle"), matcher.firstHit(record, MatchFilter.MATCH_FIELDS));
    }

    @Test
    void matchingShouldBeCaseInsensitiveOverCamelCaseFields() {
        OfferRecord record = offer("2", "Tablet case", Map.of("writeUpBody", "Fits the KOBO Clara"));

        assertTrue(prefilter.matches(record));
        assertTrue(matchFilter.isMatch(record));
    }

    @Test
    void prefilterShouldCoverEveryMatchFilterField() {
        assertTrue(Prefilter.PREFILTER_FIELDS.containsAll(MatchFilter.MATCH_FIELDS));
        for (String field : MatchFilter.MATCH_FIELDS) {
            OfferRecord record = offer("x", "", Map.of(field, "new e-ink display"));
            assertTrue(matchFilter.isMatch(record), field);
            assertTrue(prefilter.matches(record), field);
        }
    }

    @Test
    void summaryOnlyHitShouldPassPrefilterButNotMatchFilter() {
        OfferRecord record = offer("3", "Accessory bundle", Map.of("Summary", "Works with any nook"));

        assertTrue(prefilter.matches(record));
        assertFalse(matchFilter.isMatch(record));
    }

    @Test
    void filterShouldDropSeenAndIdlessRecordsAndKeepOrder() {
        List<OfferRecord> enriched = List.of(
                offer("a", "Kobo Libra", Map.of()),
                offer("b", "Kindle Scribe", Map.of()),
                offer("", "Kindle Oasis", Map.of()),
                offer("c", "Blender", Map.of()),
                offer("d", "Nook GlowLight", Map.of()));

        List<OfferRecord> out = matchFilter.filter(enriched, SeenSet.of(List.of("b")));

        assertEquals(List.of("a", "d"), out.stream().map(r -> r.id).toList());
    }

    @Test
    void keywordsShouldBeNormalized() {
        KeywordMatcher m = new KeywordMatcher(List.of(" Kindle ", "KINDLE", "", "Kobo"));

        assertEquals(List.of("kindle", "kobo"), m.keywords());
        assertNull(new KeywordMatcher(List.of()).firstHit(offer("1", "Kindle", Map.of()), MatchFilter.MATCH_FIELDS));
    }

    private static OfferRecord offer(String id, String title, Map<String, String> raw) {
        return OfferRecord.builder()
                .id(id)
                .offerId(id)
                .title(title)
                .rawText(raw)
                .build();
    }
}
