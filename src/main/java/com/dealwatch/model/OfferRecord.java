package com.dealwatch.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Canonical offer shape shared by the feed, the detail endpoint and the filters.
 *
 * <p>{@code id} and {@code offerId} always hold the same value: whichever identifier the
 * upstream payload carried is mirrored into both at ingestion.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class OfferRecord {
    public final String id;
    public final String offerId;
    public final String title;
    public final String subtitle;
    public final String snippet;
    public final String description;
    public final String summary;
    public final String name;
    public final String productName;
    public final String writeUpIntro;
    public final String writeUpBody;
    public final String features;
    public final String url;
    public final Price salePrice;
    public final Price listPrice;
    /** Every scalar text field of the upstream item, keyed by its original name. */
    public final Map<String, String> rawText;

    public boolean hasId() {
        return id != null && !id.trim().isEmpty();
    }

    /**
     * Looks up a text field by name. Tries the name as given, then its PascalCase and camelCase
     * variants in the raw payload, then the typed field of the same name.
     */
    public String text(String fieldName) {
        if (fieldName == null || fieldName.isEmpty()) {
            return "";
        }
        if (rawText != null) {
            String direct = rawText.get(fieldName);
            if (direct != null) {
                return direct;
            }
            String pascal = Character.toUpperCase(fieldName.charAt(0)) + fieldName.substring(1);
            String camel = Character.toLowerCase(fieldName.charAt(0)) + fieldName.substring(1);
            String value = rawText.get(pascal);
            if (value == null) {
                value = rawText.get(camel);
            }
            if (value != null) {
                return value;
            }
        }
        return typedText(fieldName);
    }

    private String typedText(String fieldName) {
        switch (fieldName.toLowerCase(Locale.ROOT)) {
            case "title":
                return safe(title);
            case "subtitle":
                return safe(subtitle);
            case "snippet":
                return safe(snippet);
            case "description":
                return safe(description);
            case "summary":
                return safe(summary);
            case "name":
                return safe(name);
            case "productname":
                return safe(productName);
            case "writeupintro":
                return safe(writeUpIntro);
            case "writeupbody":
                return safe(writeUpBody);
            case "features":
                return safe(features);
            default:
                return "";
        }
    }

    /**
     * Amount saved against the list price, present only when both prices exist and sale is lower.
     */
    public OptionalDouble savings() {
        if (salePrice == null || listPrice == null) {
            return OptionalDouble.empty();
        }
        double sale = salePrice.representative();
        double list = listPrice.representative();
        if (list > sale) {
            return OptionalDouble.of(list - sale);
        }
        return OptionalDouble.empty();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
