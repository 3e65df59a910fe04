package com.dealwatch.filter;

import com.dealwatch.model.OfferRecord;

import java.util.List;

/**
 * Cheap keyword scan over feed summary fields, run before any detail request.
 *
 * <p>Recall-biased: the field list is a superset of {@link MatchFilter#MATCH_FIELDS}, so anything the
 * match filter would accept on the same text also passes here. Pure and side-effect free.</p>
 */
public final class Prefilter {
    public static final List<String> PREFILTER_FIELDS = List.of(
            "Title",
            "Description",
            "Subtitle",
            "Snippet",
            "Summary",
            "Name",
            "ProductName",
            "WriteUpBody",
            "WriteUpIntro",
            "Features"
    );

    private final KeywordMatcher matcher;

    public Prefilter(KeywordMatcher matcher) {
        this.matcher = matcher;
    }

    public boolean matches(OfferRecord record) {
        return matcher.matchesAny(record, PREFILTER_FIELDS);
    }
}
