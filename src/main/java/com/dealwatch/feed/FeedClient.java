package com.dealwatch.feed;

import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.data.http.HttpClientEx;
import com.dealwatch.model.OfferRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Paginated feed retrieval. Failures never escape: whatever was collected before a failing page is
 * returned as a partial result.
 */
public final class FeedClient {
    private static final Logger LOG = LogManager.getLogger(FeedClient.class);
    private static final String[] ITEM_LIST_FIELDS = {"Items", "Offers", "Feed", "items", "offers", "feed"};
    private static final String[] TOTAL_PAGE_FIELDS = {"TotalPages", "totalPages", "PageCount", "pageCount", "Pages"};

    private final DealWatchSettings settings;
    private final HttpClientEx http;
    private final OfferRecordParser parser;

    public FeedClient(DealWatchSettings settings, HttpClientEx http) {
        this(settings, http, new OfferRecordParser());
    }

    public FeedClient(DealWatchSettings settings, HttpClientEx http, OfferRecordParser parser) {
        this.settings = settings;
        this.http = http;
        this.parser = parser;
    }

    public FetchResult fetchFeed() {
        return fetchPages(settings.feedMaxPages);
    }

    /**
     * Fetches only the first page; used by the connectivity self-check.
     */
    public FetchResult fetchFirstPage() {
        return fetchPages(1);
    }

    private FetchResult fetchPages(int maxPages) {
        List<OfferRecord> records = new ArrayList<>();
        Set<String> seenInSnapshot = new HashSet<>();
        int totalPages = 1;
        int pagesFetched = 0;
        int dropped = 0;
        int duplicates = 0;

        for (int page = 1; page <= Math.min(totalPages, maxPages); page++) {
            String url = pageUrl(page);
            try {
                HttpClientEx.Response response = http.get(url, headers(), settings.feedTimeoutSec);
                if (!response.isSuccess()) {
                    throw new IllegalStateException("feed http status=" + response.statusCode
                            + " page=" + page + " body=" + response.bodySample());
                }
                Page parsed = parsePage(response.body);
                if (parsed.totalPages > 0) {
                    totalPages = parsed.totalPages;
                }
                pagesFetched++;
                for (int i = 0; i < parsed.items.length(); i++) {
                    OfferRecord record = parser.parse(parsed.items.optJSONObject(i));
                    if (record == null) {
                        dropped++;
                        continue;
                    }
                    if (!seenInSnapshot.add(record.id)) {
                        duplicates++;
                        continue;
                    }
                    records.add(record);
                }
                LOG.info("Feed page {}/{} fetched: items={}", page, totalPages, parsed.items.length());
                if (parsed.items.isEmpty()) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Feed fetch interrupted at page {}", page);
                return FetchResult.partial(records, pagesFetched, totalPages, dropped, "feed_fetch_interrupted");
            } catch (Exception e) {
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                LOG.error("Feed fetch failed at page {}: {}", page, reason);
                return FetchResult.partial(records, pagesFetched, totalPages, dropped, reason);
            }
        }

        if (maxPages == settings.feedMaxPages && totalPages > maxPages) {
            LOG.warn("Feed reports {} pages, capped at feed.max_pages={}", totalPages, maxPages);
        }
        if (dropped > 0 || duplicates > 0) {
            LOG.info("Feed normalization dropped {} item(s) without id and {} duplicate id(s)", dropped, duplicates);
        }
        LOG.info("Fetched {} feed items from {} page(s)", records.size(), pagesFetched);
        return FetchResult.success(records, pagesFetched, totalPages, dropped);
    }

    String pageUrl(int page) {
        String category = URLEncoder.encode(settings.feedCategory, StandardCharsets.UTF_8).replace("+", "%20");
        return settings.feedEndpoint + "/" + category + "?page=" + page;
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", settings.apiKey == null ? "" : settings.apiKey);
        headers.put("Accept", "application/json");
        return headers;
    }

    static Page parsePage(String body) {
        String raw = body == null ? "" : body.trim();
        if (raw.isEmpty()) {
            return new Page(new JSONArray(), 0);
        }
        if (raw.startsWith("[")) {
            return new Page(new JSONArray(raw), 0);
        }
        JSONObject root = new JSONObject(raw);
        JSONArray items = null;
        for (String field : ITEM_LIST_FIELDS) {
            items = root.optJSONArray(field);
            if (items != null) {
                break;
            }
        }
        if (items == null) {
            throw new JSONException("feed payload has no item list");
        }
        int total = 0;
        for (String field : TOTAL_PAGE_FIELDS) {
            int value = root.optInt(field, 0);
            if (value > 0) {
                total = value;
                break;
            }
        }
        return new Page(items, total);
    }

    static final class Page {
        final JSONArray items;
        final int totalPages;

        Page(JSONArray items, int totalPages) {
            this.items = items;
            this.totalPages = totalPages;
        }
    }

    public static final class FetchResult {
        public final List<OfferRecord> records;
        public final int pagesFetched;
        public final int totalPages;
        public final int droppedWithoutId;
        public final boolean partial;
        public final String error;

        private FetchResult(
                List<OfferRecord> records,
                int pagesFetched,
                int totalPages,
                int droppedWithoutId,
                boolean partial,
                String error
        ) {
            this.records = records == null ? List.of() : List.copyOf(records);
            this.pagesFetched = Math.max(0, pagesFetched);
            this.totalPages = Math.max(0, totalPages);
            this.droppedWithoutId = Math.max(0, droppedWithoutId);
            this.partial = partial;
            this.error = error == null ? "" : error;
        }

        public static FetchResult success(List<OfferRecord> records, int pagesFetched, int totalPages, int dropped) {
            return new FetchResult(records, pagesFetched, totalPages, dropped, false, "");
        }

        public static FetchResult partial(
                List<OfferRecord> records,
                int pagesFetched,
                int totalPages,
                int dropped,
                String error
        ) {
            return new FetchResult(records, pagesFetched, totalPages, dropped, true, error);
        }

        public boolean isEmpty() {
            return records.isEmpty();
        }
    }
}
