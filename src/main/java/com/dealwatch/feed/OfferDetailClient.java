package com.dealwatch.feed;

import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.data.http.HttpClientEx;
import com.dealwatch.model.OfferRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Fetches full offer records in sequential batches, backing off on rate-limit and error replies.
 *
 * <p>The upstream limiter is undocumented, so spacing is conservative: a jittered pause between
 * batches, and per batch an exponential backoff with jitter capped at {@code detail.backoff_max_ms}.
 * A batch that exhausts {@code detail.max_attempts} is abandoned for this run and reported in
 * {@link FetchResult#abandonedIds}.</p>
 */
public final class OfferDetailClient {
    private static final Logger LOG = LogManager.getLogger(OfferDetailClient.class);
    private static final String[] RECORD_LIST_FIELDS = {"Offers", "Items", "offers", "items"};

    private final DealWatchSettings settings;
    private final HttpClientEx http;
    private final OfferRecordParser parser;
    private final Sleeper sleeper;
    private final RandomGenerator random;

    public OfferDetailClient(DealWatchSettings settings, HttpClientEx http) {
        this(settings, http, new OfferRecordParser(), Sleeper.SYSTEM, RandomGenerator.getDefault());
    }

    public OfferDetailClient(
            DealWatchSettings settings,
            HttpClientEx http,
            OfferRecordParser parser,
            Sleeper sleeper,
            RandomGenerator random
    ) {
        this.settings = settings;
        this.http = http;
        this.parser = parser;
        this.sleeper = sleeper;
        this.random = random;
    }

    public FetchResult fetchDetails(List<String> ids) {
        List<List<String>> batches = partition(ids, settings.batchSize);
        if (batches.isEmpty()) {
            return FetchResult.empty();
        }

        List<OfferRecord> records = new ArrayList<>();
        List<String> abandoned = new ArrayList<>();
        int succeeded = 0;
        int totalAttempts = 0;
        int rateLimited = 0;

        for (int i = 0; i < batches.size(); i++) {
            List<String> batch = batches.get(i);
            if (i > 0) {
                long pause = settings.batchDelayMs + jitter(settings.batchJitterMs);
                try {
                    sleeper.sleep(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Detail fetch interrupted before batch {}/{}", i + 1, batches.size());
                    for (int j = i; j < batches.size(); j++) {
                        abandoned.addAll(batches.get(j));
                    }
                    break;
                }
            }

            BatchOutcome outcome = fetchBatch(batch, i + 1, batches.size());
            totalAttempts += outcome.attempts;
            rateLimited += outcome.rateLimitedReplies;
            if (outcome.success) {
                succeeded++;
                records.addAll(outcome.records);
            } else {
                abandoned.addAll(batch);
                if (outcome.interrupted) {
                    for (int j = i + 1; j < batches.size(); j++) {
                        abandoned.addAll(batches.get(j));
                    }
                    break;
                }
            }
        }

        LOG.info("Fetched {} detailed offers: batches={} ok={} abandoned_ids={} attempts={} rate_limited={}",
                records.size(), batches.size(), succeeded, abandoned.size(), totalAttempts, rateLimited);
        return new FetchResult(records, abandoned, batches.size(), succeeded, totalAttempts, rateLimited);
    }

    private BatchOutcome fetchBatch(List<String> batch, int batchNo, int batchCount) {
        RetryState state = new RetryState(settings.maxAttempts, settings.backoffInitialMs, settings.backoffMaxMs);
        String payload = new JSONArray(batch).toString();
        int rateLimitedReplies = 0;

        while (true) {
            state.beginAttempt();
            boolean rateLimitedReply = false;
            String reason;
            try {
                HttpClientEx.Response response = http.postJson(
                        settings.detailEndpoint, payload, headers(), settings.detailTimeoutSec);
                if (response.isSuccess()) {
                    List<OfferRecord> parsed = parseRecords(response.body);
                    state.onSuccess();
                    LOG.info("Detail batch {}/{} ok: ids={} records={} attempts={}",
                            batchNo, batchCount, batch.size(), parsed.size(), state.attempts());
                    return BatchOutcome.success(parsed, state.attempts(), rateLimitedReplies);
                }
                rateLimitedReply = response.isRateLimited();
                reason = "http status=" + response.statusCode + " body=" + response.bodySample();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Detail batch {}/{} interrupted", batchNo, batchCount);
                return BatchOutcome.interrupted(state.attempts() + 1, rateLimitedReplies);
            } catch (Exception e) {
                reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }

            if (rateLimitedReply) {
                rateLimitedReplies++;
            }
            long backoff = state.onFailure(rateLimitedReply);
            if (backoff == RetryState.NO_RETRY) {
                LOG.error("Detail batch {}/{} abandoned after {} attempt(s), ids={}: {}",
                        batchNo, batchCount, state.attempts(), batch.size(), reason);
                return BatchOutcome.abandoned(state.attempts(), rateLimitedReplies);
            }
            long sleepMs = backoff + jitter(settings.backoffJitterMs);
            LOG.warn("Detail batch {}/{} attempt {} failed ({}): {}; retrying in {} ms",
                    batchNo, batchCount, state.attempts(), state.phase(), reason, sleepMs);
            try {
                sleeper.sleep(sleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return BatchOutcome.interrupted(state.attempts(), rateLimitedReplies);
            }
        }
    }

    List<OfferRecord> parseRecords(String body) {
        String raw = body == null ? "" : body.trim();
        if (raw.isEmpty()) {
            return List.of();
        }
        if (raw.startsWith("[")) {
            return parser.parseArray(new JSONArray(raw));
        }
        JSONObject root = new JSONObject(raw);
        for (String field : RECORD_LIST_FIELDS) {
            JSONArray arr = root.optJSONArray(field);
            if (arr != null) {
                return parser.parseArray(arr);
            }
        }
        throw new JSONException("detail payload has no record list");
    }

    static List<List<String>> partition(List<String> ids, int batchSize) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String id : ids) {
            if (id != null && !id.trim().isEmpty()) {
                unique.add(id.trim());
            }
        }
        int size = Math.max(1, batchSize);
        List<String> ordered = new ArrayList<>(unique);
        List<List<String>> out = new ArrayList<>();
        for (int start = 0; start < ordered.size(); start += size) {
            out.add(List.copyOf(ordered.subList(start, Math.min(start + size, ordered.size()))));
        }
        return out;
    }

    private long jitter(long boundMs) {
        if (boundMs <= 0L) {
            return 0L;
        }
        return random.nextLong(boundMs + 1L);
    }

    private Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("x-api-key", settings.apiKey == null ? "" : settings.apiKey);
        headers.put("Accept", "application/json");
        return headers;
    }

    private static final class BatchOutcome {
        final boolean success;
        final boolean interrupted;
        final List<OfferRecord> records;
        final int attempts;
        final int rateLimitedReplies;

        private BatchOutcome(boolean success, boolean interrupted, List<OfferRecord> records, int attempts, int rateLimitedReplies) {
            this.success = success;
            this.interrupted = interrupted;
            this.records = records;
            this.attempts = attempts;
            this.rateLimitedReplies = rateLimitedReplies;
        }

        static BatchOutcome success(List<OfferRecord> records, int attempts, int rateLimitedReplies) {
            return new BatchOutcome(true, false, records, attempts, rateLimitedReplies);
        }

        static BatchOutcome abandoned(int attempts, int rateLimitedReplies) {
            return new BatchOutcome(false, false, List.of(), attempts, rateLimitedReplies);
        }

        static BatchOutcome interrupted(int attempts, int rateLimitedReplies) {
            return new BatchOutcome(false, true, List.of(), attempts, rateLimitedReplies);
        }
    }

    public static final class FetchResult {
        public final List<OfferRecord> records;
        public final List<String> abandonedIds;
        public final int batches;
        public final int batchesSucceeded;
        public final int attempts;
        public final int rateLimitedReplies;

        public FetchResult(
                List<OfferRecord> records,
                List<String> abandonedIds,
                int batches,
                int batchesSucceeded,
                int attempts,
                int rateLimitedReplies
        ) {
            this.records = records == null ? List.of() : List.copyOf(records);
            this.abandonedIds = abandonedIds == null ? List.of() : List.copyOf(abandonedIds);
            this.batches = Math.max(0, batches);
            this.batchesSucceeded = Math.max(0, batchesSucceeded);
            this.attempts = Math.max(0, attempts);
            this.rateLimitedReplies = Math.max(0, rateLimitedReplies);
        }

        public static FetchResult empty() {
            return new FetchResult(List.of(), List.of(), 0, 0, 0, 0);
        }

        public int batchesAbandoned() {
            return batches - batchesSucceeded;
        }
    }
}
