package com.dealwatch.filter;

import com.dealwatch.model.OfferRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring matching of a keyword list against named record fields.
 */
public final class KeywordMatcher {
    private final List<String> keywords;

    public KeywordMatcher(List<String> keywords) {
        List<String> normalized = new ArrayList<>();
        if (keywords != null) {
            for (String keyword : keywords) {
                String k = keyword == null ? "" : keyword.trim().toLowerCase(Locale.ROOT);
                if (!k.isEmpty() && !normalized.contains(k)) {
                    normalized.add(k);
                }
            }
        }
        this.keywords = List.copyOf(normalized);
    }

    public List<String> keywords() {
        return keywords;
    }

    /**
     * First keyword found in the given fields, in field order; {@code null} when nothing matches.
     */
    public Hit firstHit(OfferRecord record, List<String> fields) {
        if (record == null || keywords.isEmpty()) {
            return null;
        }
        for (String field : fields) {
            for (String value : variants(record, field)) {
                String haystack = value.toLowerCase(Locale.ROOT);
                for (String keyword : keywords) {
                    if (haystack.contains(keyword)) {
                        return new Hit(field, keyword);
                    }
                }
            }
        }
        return null;
    }

    public boolean matchesAny(OfferRecord record, List<String> fields) {
        return firstHit(record, fields) != null;
    }

    private static List<String> variants(OfferRecord record, String field) {
        List<String> out = new ArrayList<>(3);
        if (record.rawText != null) {
            String pascal = Character.toUpperCase(field.charAt(0)) + field.substring(1);
            String camel = Character.toLowerCase(field.charAt(0)) + field.substring(1);
            addIfText(out, record.rawText.get(pascal));
            if (!camel.equals(pascal)) {
                addIfText(out, record.rawText.get(camel));
            }
        }
        addIfText(out, record.text(field));
        return out;
    }

    private static void addIfText(List<String> out, String value) {
        if (value != null && !value.isEmpty() && !out.contains(value)) {
            out.add(value);
        }
    }

    public record Hit(String field, String keyword) {
    }
}
