package com.dealwatch.filter;

import com.dealwatch.model.OfferRecord;
import com.dealwatch.state.SeenSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Authoritative match decision on enriched records. Drops records without an id and records already
 * in the seen set; keeps input order.
 */
public final class MatchFilter {
    private static final Logger LOG = LogManager.getLogger(MatchFilter.class);

    public static final List<String> MATCH_FIELDS = List.of(
            "Title",
            "WriteUpBody",
            "Features",
            "Description",
            "Subtitle",
            "Snippet",
            "WriteUpIntro"
    );

    private final KeywordMatcher matcher;

    public MatchFilter(KeywordMatcher matcher) {
        this.matcher = matcher;
    }

    public List<OfferRecord> filter(List<OfferRecord> enriched, SeenSet seenSet) {
        List<OfferRecord> out = new ArrayList<>();
        if (enriched == null) {
            return out;
        }
        for (OfferRecord record : enriched) {
            if (record == null || !record.hasId()) {
                continue;
            }
            if (seenSet != null && seenSet.contains(record.id)) {
                continue;
            }
            KeywordMatcher.Hit hit = matcher.firstHit(record, MATCH_FIELDS);
            if (hit != null) {
                LOG.debug("Offer {} matched keyword '{}' in {}", record.id, hit.keyword(), hit.field());
                out.add(record);
            }
        }
        LOG.info("Found {} new matching deals.", out.size());
        return out;
    }

    public boolean isMatch(OfferRecord record) {
        return record != null && record.hasId() && matcher.matchesAny(record, MATCH_FIELDS);
    }
}
