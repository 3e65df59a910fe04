package com.dealwatch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DealWatchSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void batchSizeShouldBeClampedToUpstreamCap() {
        DealWatchSettings settings = DealWatchSettings.from(Config.fromMap(tempDir, Map.of("detail.batch_size", "100")));

        assertEquals(DealWatchSettings.DETAIL_BATCH_HARD_CAP, settings.batchSize);
    }

    @Test
    void keywordsShouldBeLowercasedAndDeduplicated() {
        DealWatchSettings settings = DealWatchSettings.from(Config.fromMap(tempDir, Map.of("keywords", "Kindle, KINDLE;Kobo")));

        assertEquals(List.of("kindle", "kobo"), settings.keywords);
    }

    @Test
    void missingRequiredShouldListAbsentSecrets() {
        DealWatchSettings settings = DealWatchSettings.from(Config.fromMap(tempDir, Map.of()));

        assertEquals(List.of("woot.api_key", "seen.bucket"), settings.missingRequired());
    }

    @Test
    void fileStoreShouldNotNeedBucket() {
        DealWatchSettings settings = DealWatchSettings.from(Config.fromMap(tempDir, Map.of(
                "woot.api_key", "k",
                "seen.store", "FILE",
                "feed.endpoint", "https://developer.woot.com/feed/")));

        assertTrue(settings.missingRequired().isEmpty());
        assertEquals("file", settings.seenStore);
        assertEquals("https://developer.woot.com/feed", settings.feedEndpoint);
    }
}
