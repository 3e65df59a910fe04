package com.dealwatch.state;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only set of processed offer ids, kept in insertion order.
 */
public final class SeenSet {
    private final Set<String> ids = new LinkedHashSet<>();

    public static SeenSet empty() {
        return new SeenSet();
    }

    public static SeenSet of(Collection<String> ids) {
        SeenSet s = new SeenSet();
        s.addAll(ids);
        return s;
    }

    /**
     * Decodes the persisted form: a UTF-8 JSON array of strings. Blank text is an empty set.
     */
    public static SeenSet fromJson(String text) {
        SeenSet s = new SeenSet();
        if (text == null || text.trim().isEmpty()) {
            return s;
        }
        JSONArray arr = new JSONArray(text.trim());
        for (int i = 0; i < arr.length(); i++) {
            Object value = arr.opt(i);
            if (value == null || value == JSONObject.NULL || value instanceof JSONArray || value instanceof JSONObject) {
                throw new JSONException("seen set entry " + i + " is not a string id");
            }
            s.add(String.valueOf(value));
        }
        return s;
    }

    public String toJson() {
        return new JSONArray(ids).toString();
    }

    public boolean contains(String id) {
        return id != null && ids.contains(id);
    }

    public boolean add(String id) {
        if (id == null || id.trim().isEmpty()) {
            return false;
        }
        return ids.add(id);
    }

    public int addAll(Collection<String> newIds) {
        if (newIds == null) {
            return 0;
        }
        int added = 0;
        for (String id : newIds) {
            if (add(id)) {
                added++;
            }
        }
        return added;
    }

    public int size() {
        return ids.size();
    }

    public List<String> snapshot() {
        return new ArrayList<>(ids);
    }

    public SeenSet copy() {
        return of(ids);
    }
}
