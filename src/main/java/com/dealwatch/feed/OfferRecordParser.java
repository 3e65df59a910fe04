package com.dealwatch.feed;

import com.dealwatch.model.OfferRecord;
import com.dealwatch.model.Price;
import org.json.JSONArray;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps upstream JSON items (feed entries and detail records alike) to {@link OfferRecord}.
 */
public final class OfferRecordParser {
    static final String[] ID_FIELDS = {"OfferId", "Id", "offerId", "id"};
    private static final String[] PRICE_OBJECT_FIELDS = {"Price", "SalePrice", "Amount", "Value", "Minimum"};

    /**
     * Returns {@code null} when the item carries no usable identifier.
     */
    public OfferRecord parse(JSONObject item) {
        if (item == null) {
            return null;
        }
        String id = resolveId(item);
        if (id.isEmpty()) {
            return null;
        }

        Map<String, String> rawText = new LinkedHashMap<>();
        for (String key : item.keySet()) {
            Object value = item.opt(key);
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                rawText.put(key, String.valueOf(value));
            } else if (value instanceof JSONArray && isTextArray((JSONArray) value)) {
                rawText.put(key, joinText((JSONArray) value));
            }
        }
        rawText.put("OfferId", id);
        rawText.put("Id", id);

        JSONObject firstItem = firstChildItem(item);
        Price sale = firstPrice(item, firstItem, "SalePrice", "salePrice");
        Price list = firstPrice(item, firstItem, "ListPrice", "listPrice");

        return OfferRecord.builder()
                .id(id)
                .offerId(id)
                .title(text(rawText, "Title"))
                .subtitle(text(rawText, "Subtitle"))
                .snippet(text(rawText, "Snippet"))
                .description(text(rawText, "Description"))
                .summary(text(rawText, "Summary"))
                .name(text(rawText, "Name"))
                .productName(text(rawText, "ProductName"))
                .writeUpIntro(text(rawText, "WriteUpIntro"))
                .writeUpBody(text(rawText, "WriteUpBody"))
                .features(text(rawText, "Features"))
                .url(text(rawText, "Url"))
                .salePrice(sale)
                .listPrice(list)
                .rawText(Collections.unmodifiableMap(rawText))
                .build();
    }

    public List<OfferRecord> parseArray(JSONArray items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<OfferRecord> out = new ArrayList<>(items.length());
        for (int i = 0; i < items.length(); i++) {
            OfferRecord record = parse(items.optJSONObject(i));
            if (record != null) {
                out.add(record);
            }
        }
        return out;
    }

    static String resolveId(JSONObject item) {
        for (String field : ID_FIELDS) {
            Object raw = item.opt(field);
            if (raw == null || raw == JSONObject.NULL) {
                continue;
            }
            String value = String.valueOf(raw).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    /**
     * Parses a scalar, a numeric string, a list of amounts or a list of price objects.
     */
    static Price parsePrice(Object raw) {
        if (raw == null || raw == JSONObject.NULL) {
            return null;
        }
        if (raw instanceof Number) {
            double amount = ((Number) raw).doubleValue();
            return Double.isFinite(amount) ? Price.scalar(amount) : null;
        }
        if (raw instanceof String) {
            Double amount = parseAmount((String) raw);
            return amount == null ? null : Price.scalar(amount);
        }
        if (raw instanceof JSONObject) {
            Double amount = amountOf((JSONObject) raw);
            return amount == null ? null : Price.scalar(amount);
        }
        if (raw instanceof JSONArray) {
            JSONArray arr = (JSONArray) raw;
            List<Double> amounts = new ArrayList<>();
            for (int i = 0; i < arr.length(); i++) {
                Object element = arr.opt(i);
                Double amount = null;
                if (element instanceof Number) {
                    amount = ((Number) element).doubleValue();
                } else if (element instanceof String) {
                    amount = parseAmount((String) element);
                } else if (element instanceof JSONObject) {
                    amount = amountOf((JSONObject) element);
                }
                if (amount != null && Double.isFinite(amount)) {
                    amounts.add(amount);
                }
            }
            if (amounts.isEmpty()) {
                return null;
            }
            return amounts.size() == 1 ? Price.scalar(amounts.get(0)) : Price.tiered(amounts);
        }
        return null;
    }

    private static Double amountOf(JSONObject obj) {
        for (String field : PRICE_OBJECT_FIELDS) {
            Object value = obj.opt(field);
            if (value instanceof Number) {
                return ((Number) value).doubleValue();
            }
            if (value instanceof String) {
                Double parsed = parseAmount((String) value);
                if (parsed != null) {
                    return parsed;
                }
            }
        }
        return null;
    }

    private static Double parseAmount(String raw) {
        String cleaned = raw == null ? "" : raw.replace("$", "").replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned).doubleValue();
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private Price firstPrice(JSONObject item, JSONObject firstItem, String... fields) {
        for (String field : fields) {
            Price price = parsePrice(item.opt(field));
            if (price != null) {
                return price;
            }
        }
        if (firstItem != null) {
            for (String field : fields) {
                Price price = parsePrice(firstItem.opt(field));
                if (price != null) {
                    return price;
                }
            }
        }
        return null;
    }

    private JSONObject firstChildItem(JSONObject item) {
        JSONArray items = item.optJSONArray("Items");
        if (items == null) {
            items = item.optJSONArray("items");
        }
        if (items == null || items.isEmpty()) {
            return null;
        }
        return items.optJSONObject(0);
    }

    private boolean isTextArray(JSONArray arr) {
        for (int i = 0; i < arr.length(); i++) {
            if (!(arr.opt(i) instanceof String)) {
                return false;
            }
        }
        return !arr.isEmpty();
    }

    private String joinText(JSONArray arr) {
        List<String> parts = new ArrayList<>(arr.length());
        for (int i = 0; i < arr.length(); i++) {
            parts.add(arr.optString(i, ""));
        }
        return String.join("\n", parts);
    }

    private String text(Map<String, String> rawText, String pascalName) {
        String value = rawText.get(pascalName);
        if (value == null) {
            String camel = Character.toLowerCase(pascalName.charAt(0)) + pascalName.substring(1);
            value = rawText.get(camel);
        }
        return value == null ? "" : value;
    }
}
