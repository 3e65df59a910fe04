package com.dealwatch.app;

import com.dealwatch.config.Config;
import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.data.http.HttpClientEx;
import com.dealwatch.feed.FeedClient;
import com.dealwatch.feed.OfferDetailClient;
import com.dealwatch.filter.KeywordMatcher;
import com.dealwatch.filter.MatchFilter;
import com.dealwatch.filter.Prefilter;
import com.dealwatch.output.MailNotifier;
import com.dealwatch.output.Mailer;
import com.dealwatch.runner.DealPipeline;
import com.dealwatch.state.FileSeenSetStore;
import com.dealwatch.state.S3SeenSetStore;
import com.dealwatch.state.SeenSetStore;

import java.util.Locale;

/**
 * Wires pipeline components from configuration. The seen-set store is built once and shared by
 * every pipeline the factory creates; {@link #close()} releases it.
 */
public class PipelineFactory implements AutoCloseable {
    private final Config config;
    private final DealWatchSettings settings;
    private final HttpClientEx http;
    private SeenSetStore seenSetStore;

    public PipelineFactory(Config config) {
        this(config, DealWatchSettings.from(config), new HttpClientEx());
    }

    public PipelineFactory(Config config, DealWatchSettings settings, HttpClientEx http) {
        this.config = config;
        this.settings = settings;
        this.http = http;
    }

    public Config config() {
        return config;
    }

    public DealWatchSettings settings() {
        return settings;
    }

    public synchronized SeenSetStore seenSetStore() {
        if (seenSetStore == null) {
            seenSetStore = createSeenSetStore();
        }
        return seenSetStore;
    }

    protected SeenSetStore createSeenSetStore() {
        String store = settings.seenStore == null ? "s3" : settings.seenStore.trim().toLowerCase(Locale.ROOT);
        switch (store) {
            case "file":
                return new FileSeenSetStore(settings.seenFile);
            case "s3":
                return S3SeenSetStore.create(settings.seenRegion, settings.seenBucket, settings.seenKey);
            default:
                throw new IllegalArgumentException("seen.store must be s3 or file, got: " + settings.seenStore);
        }
    }

    public FeedClient feedClient() {
        return new FeedClient(settings, http);
    }

    public OfferDetailClient detailClient() {
        return new OfferDetailClient(settings, http);
    }

    /**
     * Detail client that gives up after one request; connectivity checks should not back off.
     */
    public OfferDetailClient probeDetailClient() {
        return new OfferDetailClient(settings.toBuilder().maxAttempts(1).build(), http);
    }

    public Mailer mailer() {
        return new Mailer();
    }

    public Mailer.Settings mailSettings() {
        return Mailer.loadSettings(config);
    }

    public DealPipeline pipeline() {
        KeywordMatcher matcher = new KeywordMatcher(settings.keywords);
        return new DealPipeline(
                seenSetStore(),
                feedClient(),
                new Prefilter(matcher),
                detailClient(),
                new MatchFilter(matcher),
                new MailNotifier(mailer(), mailSettings())
        );
    }

    @Override
    public synchronized void close() {
        if (seenSetStore != null) {
            seenSetStore.close();
            seenSetStore = null;
        }
    }
}
