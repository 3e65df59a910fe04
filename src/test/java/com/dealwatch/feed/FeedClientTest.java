package com.dealwatch.feed;

import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.data.http.HttpClientEx;
import com.dealwatch.data.http.ScriptedHttpClient;
import com.dealwatch.model.OfferRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeedClientTest {

    @TempDir
    Path tempDir;

    @Test
    void fetchFeedShouldCollectAllPagesAndMirrorIds() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        String page1 = "{\"TotalPages\":2,\"Items\":" + TestSettings.offersJson(1, 15, "Gadget") + "}";
        String page2 = "{\"TotalPages\":2,\"Items\":"
                + TestSettings.offersJson(16, 10, "Gadget").replace("\"OfferId\"", "\"Id\"") + "}";
        ScriptedHttpClient http = new ScriptedHttpClient().reply(200, page1).reply(200, page2);

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertEquals(25, result.records.size());
        assertEquals(2, result.pagesFetched);
        assertFalse(result.partial);
        for (OfferRecord record : result.records) {
            assertFalse(record.id.isEmpty());
            assertEquals(record.id, record.offerId);
            assertEquals(record.id, record.rawText.get("OfferId"));
            assertEquals(record.id, record.rawText.get("Id"));
        }
        assertEquals("offer-16", result.records.get(15).id);
        assertEquals("http://woot.test/feed/Electronics?page=2", http.requests.get(1).url);
        assertEquals("test-key", http.requests.get(0).headers.get("x-api-key"));
    }

    @Test
    void bareArrayShouldBeTreatedAsSinglePage() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        ScriptedHttpClient http = new ScriptedHttpClient().reply(200, TestSettings.offersJson(1, 3, "Lamp"));

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertEquals(3, result.records.size());
        assertEquals(1, http.requests.size());
    }

    @Test
    void failureOnFirstPageShouldYieldEmptyPartialResult() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        ScriptedHttpClient http = new ScriptedHttpClient().reply(503, "unavailable");

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertTrue(result.isEmpty());
        assertTrue(result.partial);
        assertTrue(result.error.contains("503"));
    }

    @Test
    void failureOnLaterPageShouldKeepEarlierItems() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        String page1 = "{\"TotalPages\":3,\"Items\":" + TestSettings.offersJson(1, 5, "Gadget") + "}";
        ScriptedHttpClient http = new ScriptedHttpClient()
                .reply(200, page1)
                .fail(new IOException("connection reset"));

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertEquals(5, result.records.size());
        assertTrue(result.partial);
        assertEquals(1, result.pagesFetched);
        assertEquals(2, http.requests.size());
    }

    @Test
    void itemsWithoutIdAndDuplicatesShouldBeDropped() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        String body = "{\"Items\":[{\"Title\":\"no id\"},{\"Id\":\"a\",\"Title\":\"first\"},"
                + "{\"OfferId\":\"a\",\"Title\":\"dup\"},{\"Id\":\"b\",\"Title\":\"second\"}]}";
        ScriptedHttpClient http = new ScriptedHttpClient().reply(200, body);

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertEquals(2, result.records.size());
        assertEquals("first", result.records.get(0).title);
        assertEquals(1, result.droppedWithoutId);
    }

    @Test
    void maxPagesShouldCapTheLoop() {
        DealWatchSettings settings = TestSettings.create(tempDir, "feed.max_pages", "2");
        AtomicInteger next = new AtomicInteger(1);
        ScriptedHttpClient http = new ScriptedHttpClient()
                .route(request -> new HttpClientEx.Response(200,
                        "{\"TotalPages\":9,\"Items\":" + TestSettings.offersJson(next.getAndIncrement(), 1, "x") + "}"));

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertEquals(2, http.requests.size());
        assertEquals(2, result.pagesFetched);
    }

    @Test
    void payloadWithoutItemListShouldFailAsPartial() {
        DealWatchSettings settings = TestSettings.create(tempDir);
        ScriptedHttpClient http = new ScriptedHttpClient().reply(200, "{\"message\":\"nope\"}");

        FeedClient.FetchResult result = new FeedClient(settings, http).fetchFeed();

        assertTrue(result.isEmpty());
        assertTrue(result.partial);
    }
}
