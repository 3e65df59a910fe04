package com.dealwatch.runner;

import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.data.http.HttpClientEx;
import com.dealwatch.data.http.ScriptedHttpClient;
import com.dealwatch.feed.FeedClient;
import com.dealwatch.feed.OfferDetailClient;
import com.dealwatch.feed.OfferRecordParser;
import com.dealwatch.feed.TestSettings;
import com.dealwatch.filter.KeywordMatcher;
import com.dealwatch.filter.MatchFilter;
import com.dealwatch.filter.Prefilter;
import com.dealwatch.model.OfferRecord;
import com.dealwatch.output.DealNotifier;
import com.dealwatch.state.SeenSet;
import com.dealwatch.state.SeenSetStore;
import com.dealwatch.state.SeenSetStoreException;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DealPipelineTest {

    @TempDir
    Path tempDir;

    private final Map<String, JSONObject> catalog = new LinkedHashMap<>();
    private final Map<String, String> feedTitles = new LinkedHashMap<>();
    private final Set<String> rateLimitedIds = new HashSet<>();
    private final InMemoryStore store = new InMemoryStore();
    private final RecordingNotifier notifier = new RecordingNotifier();
    private ScriptedHttpClient http;

    @Test
    void matchingDealShouldBeNotifiedOnceAndSurviveReRun() {
        offer("1", "Kindle Paperwhite 8GB");
        offer("2", "Stand mixer");
        offer("3", "Kobo Libra Colour");

        PipelineOutcome first = pipeline().run();

        assertEquals(PipelineOutcome.Status.NOTIFIED, first.status);
        assertEquals(List.of("1", "3"), ids(first.matches));
        assertEquals(1, notifier.calls.size());
        assertEquals(Set.of("1", "3"), Set.copyOf(store.saved.snapshot()));
        assertEquals(1, store.saves);

        PipelineOutcome second = pipeline().run();

        assertEquals(PipelineOutcome.Status.NO_MATCHES, second.status);
        assertEquals(1, notifier.calls.size());
        assertEquals(0, second.candidates);
        assertEquals(Set.of("1", "2", "3"), Set.copyOf(store.saved.snapshot()));
    }

    @Test
    void failedNotificationShouldLeaveSeenSetUntouched() {
        offer("1", "Kindle Scribe");
        notifier.result = false;

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.NOTIFY_FAILED, outcome.status);
        assertFalse(outcome.isSuccess());
        assertEquals(0, store.saves);

        notifier.result = true;
        PipelineOutcome retry = pipeline().run();

        assertEquals(PipelineOutcome.Status.NOTIFIED, retry.status);
        assertEquals(2, notifier.calls.size());
        assertEquals(List.of("1"), store.saved.snapshot());
    }

    @Test
    void noCandidatesShouldMarkInspectedFeedIdsSeen() {
        offer("10", "Air fryer");
        offer("11", "Headphones");

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.NO_MATCHES, outcome.status);
        assertEquals(List.of("10", "11"), store.saved.snapshot());
        assertEquals(0, http.count("POST"));
        assertTrue(notifier.calls.isEmpty());
    }

    @Test
    void enrichedNonMatchesShouldBeCommittedWithoutNotifying() {
        offer("20", "Nook cover");
        catalog.put("20", new JSONObject().put("OfferId", "20").put("Title", "Tablet sleeve"));

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.NO_MATCHES, outcome.status);
        assertEquals(1, outcome.candidates);
        assertEquals(List.of("20"), store.saved.snapshot());
        assertTrue(notifier.calls.isEmpty());
    }

    @Test
    void abandonedBatchIdsShouldNotBeMarkedSeen() {
        offer("1", "Kindle Basic");
        offer("2", "Kobo Clara");
        rateLimitedIds.add("2");

        PipelineOutcome outcome = pipeline("detail.batch_size", "1", "detail.max_attempts", "2").run();

        assertEquals(PipelineOutcome.Status.NOTIFIED, outcome.status);
        assertEquals(1, outcome.abandonedIds);
        assertEquals(List.of("1"), store.saved.snapshot());
        assertEquals(3, http.count("POST"));
    }

    @Test
    void alreadySeenCandidatesShouldNotBeEnrichedAgain() {
        offer("1", "Kindle Basic");
        offer("2", "Kobo Clara");
        store.current = SeenSet.of(List.of("1"));

        PipelineOutcome outcome = pipeline().run();

        assertEquals(List.of("2"), ids(outcome.matches));
        assertEquals("[\"2\"]", http.requests.get(1).body);
    }

    @Test
    void emptyFeedShouldReportNoDataAndKeepSeenSet() {
        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.NO_FEED_DATA, outcome.status);
        assertEquals("No feed items found", outcome.summary);
        assertTrue(outcome.isSuccess());
        assertEquals(0, store.saves);
    }

    @Test
    void seenSetLoadFailureShouldStillNotifyButNeverSave() {
        offer("1", "Kindle Paperwhite 8GB");
        store.current = SeenSet.of(List.of("900", "901"));
        store.loadError = "seen_load_failed: s3 unreachable";

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.COMMIT_FAILED, outcome.status);
        assertFalse(outcome.isSuccess());
        assertEquals(1, outcome.exitCode());
        assertEquals(1, notifier.calls.size());
        assertEquals(List.of("1"), ids(notifier.calls.get(0)));
        assertEquals(0, store.saves);
        assertEquals(List.of("900", "901"), store.current.snapshot());
        assertTrue(outcome.summary.endsWith("seen set unavailable, state not saved"), outcome.summary);
    }

    @Test
    void seenSetLoadFailureWithEmptyFeedShouldReportFailure() {
        store.loadError = "seen_load_failed: access denied";

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.COMMIT_FAILED, outcome.status);
        assertEquals(0, store.saves);
        assertTrue(notifier.calls.isEmpty());
    }

    @Test
    void fullyAbandonedEnrichmentShouldMentionDeferredIds() {
        offer("1", "Kindle Basic");
        offer("2", "Kobo Clara");
        rateLimitedIds.add("1");
        rateLimitedIds.add("2");

        PipelineOutcome outcome = pipeline("detail.batch_size", "1", "detail.max_attempts", "1").run();

        assertEquals(PipelineOutcome.Status.NO_MATCHES, outcome.status);
        assertEquals(2, outcome.abandonedIds);
        assertEquals("No new matching deals among 2 candidate(s); 2 id(s) deferred after abandoned batches",
                outcome.summary);
        assertEquals(0, store.saves);
    }

    @Test
    void persistFailureShouldReportCommitFailedAfterNotifying() {
        offer("1", "Kindle Basic");
        store.saveError = true;

        PipelineOutcome outcome = pipeline().run();

        assertEquals(PipelineOutcome.Status.COMMIT_FAILED, outcome.status);
        assertEquals(1, notifier.calls.size());
        assertEquals(1, outcome.exitCode());
    }

    @Test
    void telemetryShouldRecordEveryStepOfAMatchingRun() {
        offer("1", "Kindle Basic");

        PipelineOutcome outcome = pipeline().run();

        String summary = outcome.telemetry.getSummary();
        for (String step : List.of("SEEN_LOAD", "FEED_FETCH", "PREFILTER", "DETAIL_FETCH", "MATCH", "MAIL_SEND", "SEEN_COMMIT")) {
            assertTrue(summary.contains(step), step);
        }
        assertTrue(summary.contains("matches=1"));
    }

    private DealPipeline pipeline(String... overrides) {
        DealWatchSettings settings = TestSettings.create(tempDir, overrides);
        http = new ScriptedHttpClient().route(this::answer);
        KeywordMatcher matcher = new KeywordMatcher(settings.keywords);
        return new DealPipeline(
                store,
                new FeedClient(settings, http),
                new Prefilter(matcher),
                new OfferDetailClient(settings, http, new OfferRecordParser(), millis -> { }, () -> 0L),
                new MatchFilter(matcher),
                notifier
        );
    }

    private HttpClientEx.Response answer(ScriptedHttpClient.Request request) {
        if (request.method.equals("GET")) {
            JSONArray items = new JSONArray();
            for (String id : catalog.keySet()) {
                items.put(new JSONObject().put("OfferId", id).put("Title", feedTitles.get(id)));
            }
            return new HttpClientEx.Response(200, new JSONObject().put("TotalPages", 1).put("Items", items).toString());
        }
        JSONArray requested = new JSONArray(request.body);
        JSONArray out = new JSONArray();
        for (int i = 0; i < requested.length(); i++) {
            String id = requested.getString(i);
            if (rateLimitedIds.contains(id)) {
                return new HttpClientEx.Response(429, "");
            }
            out.put(catalog.get(id));
        }
        return new HttpClientEx.Response(200, out.toString());
    }

    private void offer(String id, String title) {
        feedTitles.put(id, title);
        catalog.put(id, new JSONObject().put("OfferId", id).put("Title", title).put("Url", "https://woot.test/" + id));
    }

    private static List<String> ids(List<OfferRecord> records) {
        List<String> out = new ArrayList<>();
        for (OfferRecord record : records) {
            out.add(record.id);
        }
        return out;
    }

    private static final class InMemoryStore implements SeenSetStore {
        SeenSet current;
        SeenSet saved;
        int saves;
        String loadError;
        boolean saveError;

        @Override
        public LoadResult load() {
            if (loadError != null) {
                return LoadResult.failed(loadError);
            }
            return current == null ? LoadResult.absent() : LoadResult.loaded(current.copy());
        }

        @Override
        public void save(SeenSet seenSet) {
            if (saveError) {
                throw new SeenSetStoreException("bucket unavailable");
            }
            saves++;
            saved = seenSet.copy();
            current = seenSet.copy();
        }

        @Override
        public String describe() {
            return "memory";
        }
    }

    private static final class RecordingNotifier implements DealNotifier {
        final List<List<OfferRecord>> calls = new ArrayList<>();
        boolean result = true;

        @Override
        public boolean send(List<OfferRecord> deals) {
            calls.add(List.copyOf(deals));
            return result;
        }
    }
}
