package com.dealwatch.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Immutable pipeline settings resolved once from {@link Config} and handed to each component.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DealWatchSettings {
    /** Upstream hard cap on ids per detail request. */
    public static final int DETAIL_BATCH_HARD_CAP = 25;

    public final String apiKey;

    public final String feedEndpoint;
    public final String feedCategory;
    public final int feedMaxPages;
    public final int feedTimeoutSec;

    public final String detailEndpoint;
    public final int detailTimeoutSec;
    public final int batchSize;
    public final long batchDelayMs;
    public final long batchJitterMs;
    public final int maxAttempts;
    public final long backoffInitialMs;
    public final long backoffMaxMs;
    public final long backoffJitterMs;

    public final List<String> keywords;

    public final String seenStore;
    public final String seenBucket;
    public final String seenRegion;
    public final String seenKey;
    public final Path seenFile;

    public final int scheduleIntervalMinutes;

    public static DealWatchSettings from(Config config) {
        List<String> keywords = new ArrayList<>();
        for (String keyword : config.getList("keywords")) {
            String normalized = keyword.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty() && !keywords.contains(normalized)) {
                keywords.add(normalized);
            }
        }
        long backoffInitial = Math.max(1L, config.getLong("detail.backoff_initial_ms", 2000L));
        return DealWatchSettings.builder()
                .apiKey(config.getString("woot.api_key", ""))
                .feedEndpoint(stripTrailingSlash(config.getString("feed.endpoint")))
                .feedCategory(config.getString("feed.category", "Electronics"))
                .feedMaxPages(Math.max(1, config.getInt("feed.max_pages", 50)))
                .feedTimeoutSec(Math.max(3, config.getInt("feed.timeout_sec", 20)))
                .detailEndpoint(config.getString("detail.endpoint"))
                .detailTimeoutSec(Math.max(3, config.getInt("detail.timeout_sec", 20)))
                .batchSize(Math.min(DETAIL_BATCH_HARD_CAP, Math.max(1, config.getInt("detail.batch_size", 20))))
                .batchDelayMs(Math.max(0L, config.getLong("detail.batch_delay_ms", 1000L)))
                .batchJitterMs(Math.max(0L, config.getLong("detail.batch_jitter_ms", 500L)))
                .maxAttempts(Math.max(1, config.getInt("detail.max_attempts", 5)))
                .backoffInitialMs(backoffInitial)
                .backoffMaxMs(Math.max(backoffInitial, config.getLong("detail.backoff_max_ms", 30000L)))
                .backoffJitterMs(Math.max(0L, config.getLong("detail.backoff_jitter_ms", 1000L)))
                .keywords(List.copyOf(keywords))
                .seenStore(config.getString("seen.store", "s3").toLowerCase(Locale.ROOT))
                .seenBucket(config.getString("seen.bucket", ""))
                .seenRegion(config.getString("seen.region", "us-east-1"))
                .seenKey(config.getString("seen.key", "seen_deals.json"))
                .seenFile(config.getPath("seen.file"))
                .scheduleIntervalMinutes(Math.max(1, config.getInt("schedule.interval_minutes", 30)))
                .build();
    }

    /**
     * Config keys that must be set before a live run; empty when the settings are usable.
     */
    public List<String> missingRequired() {
        List<String> missing = new ArrayList<>();
        if (isBlank(apiKey)) {
            missing.add("woot.api_key");
        }
        if (isBlank(feedEndpoint)) {
            missing.add("feed.endpoint");
        }
        if (isBlank(detailEndpoint)) {
            missing.add("detail.endpoint");
        }
        if (keywords == null || keywords.isEmpty()) {
            missing.add("keywords");
        }
        if ("s3".equals(seenStore) && isBlank(seenBucket)) {
            missing.add("seen.bucket");
        }
        return missing;
    }

    private static String stripTrailingSlash(String value) {
        String v = value == null ? "" : value.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
