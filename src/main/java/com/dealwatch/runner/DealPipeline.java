package com.dealwatch.runner;

import com.dealwatch.core.RunTelemetry;
import com.dealwatch.feed.FeedClient;
import com.dealwatch.feed.OfferDetailClient;
import com.dealwatch.filter.MatchFilter;
import com.dealwatch.filter.Prefilter;
import com.dealwatch.model.OfferRecord;
import com.dealwatch.output.DealNotifier;
import com.dealwatch.state.SeenSet;
import com.dealwatch.state.SeenSetStore;
import com.dealwatch.state.SeenSetStoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One deal-discovery run: load the seen set, fetch the feed, prefilter, enrich, match, notify,
 * and commit the seen set.
 *
 * <p>The seen set is only written after the notification for the run's matches succeeded. A failed
 * notification leaves the stored set untouched so the same deals are retried on the next run.
 * Ids from abandoned detail batches are never marked seen.</p>
 *
 * <p>When the seen set cannot be loaded the run still notifies, starting from an empty set, but
 * never writes the store and ends {@link PipelineOutcome.Status#COMMIT_FAILED}.</p>
 */
public final class DealPipeline {
    private static final Logger LOG = LogManager.getLogger(DealPipeline.class);

    private final SeenSetStore seenStore;
    private final FeedClient feedClient;
    private final Prefilter prefilter;
    private final OfferDetailClient detailClient;
    private final MatchFilter matchFilter;
    private final DealNotifier notifier;

    public DealPipeline(
            SeenSetStore seenStore,
            FeedClient feedClient,
            Prefilter prefilter,
            OfferDetailClient detailClient,
            MatchFilter matchFilter,
            DealNotifier notifier
    ) {
        this.seenStore = seenStore;
        this.feedClient = feedClient;
        this.prefilter = prefilter;
        this.detailClient = detailClient;
        this.matchFilter = matchFilter;
        this.notifier = notifier;
    }

    public PipelineOutcome run() {
        return run("ONCE", "manual");
    }

    public PipelineOutcome run(String runMode, String trigger) {
        RunTelemetry telemetry = new RunTelemetry(runMode, trigger, Instant.now());
        PipelineOutcome outcome;
        try {
            outcome = execute(telemetry);
        } catch (RuntimeException e) {
            LOG.error("Pipeline run failed unexpectedly", e);
            telemetry.incrementErrors(1);
            outcome = PipelineOutcome.failed("Unexpected error: " + describe(e), telemetry);
        }
        telemetry.finish();
        LOG.info("Run finished: {}\n{}", outcome, telemetry.getSummary());
        return outcome;
    }

    private PipelineOutcome execute(RunTelemetry telemetry) {
        telemetry.startStep(RunTelemetry.STEP_SEEN_LOAD);
        SeenSetStore.LoadResult loaded = seenStore.load();
        boolean storeAvailable = loaded.success;
        SeenSet seenSet = loaded.seenSet;
        if (storeAvailable) {
            telemetry.endStep(RunTelemetry.STEP_SEEN_LOAD, 0, seenSet.size(), 0, loaded.existed ? "" : "absent");
        } else {
            telemetry.endStep(RunTelemetry.STEP_SEEN_LOAD, 0, 0, 1, loaded.error);
            LOG.error("Seen set could not be loaded from {}; continuing with an empty set, state will not be saved: {}",
                    seenStore.describe(), loaded.error);
        }

        telemetry.startStep(RunTelemetry.STEP_FEED_FETCH);
        FeedClient.FetchResult feed = feedClient.fetchFeed();
        telemetry.endStep(RunTelemetry.STEP_FEED_FETCH, feed.pagesFetched, feed.records.size(),
                feed.partial ? 1 : 0, feed.partial ? "partial: " + feed.error : "");
        if (feed.isEmpty()) {
            LOG.warn("No feed items found");
            telemetry.setDealStats(0, 0, 0, 0);
            if (!storeAvailable) {
                return commit(telemetry, false, seenSet, List.of(), PipelineOutcome.Status.NO_FEED_DATA,
                        "No feed items found", 0, 0, 0, 0, List.of());
            }
            return new PipelineOutcome(PipelineOutcome.Status.NO_FEED_DATA, "No feed items found",
                    0, 0, 0, 0, 0, List.of(), telemetry);
        }

        telemetry.startStep(RunTelemetry.STEP_PREFILTER);
        List<String> candidateIds = new ArrayList<>();
        int alreadySeen = 0;
        for (OfferRecord record : feed.records) {
            if (!prefilter.matches(record)) {
                continue;
            }
            if (seenSet.contains(record.id)) {
                alreadySeen++;
                continue;
            }
            candidateIds.add(record.id);
        }
        telemetry.endStep(RunTelemetry.STEP_PREFILTER, feed.records.size(), candidateIds.size(), 0,
                alreadySeen > 0 ? "already_seen=" + alreadySeen : "");
        LOG.info("Prefilter kept {} candidate(s) of {} feed item(s), skipped {} already seen",
                candidateIds.size(), feed.records.size(), alreadySeen);

        if (candidateIds.isEmpty()) {
            List<String> inspected = new ArrayList<>(feed.records.size());
            for (OfferRecord record : feed.records) {
                inspected.add(record.id);
            }
            telemetry.setDealStats(feed.records.size(), 0, 0, 0);
            return commit(telemetry, storeAvailable, seenSet, inspected, PipelineOutcome.Status.NO_MATCHES,
                    "No candidate deals in " + feed.records.size() + " feed item(s)",
                    feed.records.size(), 0, 0, 0, List.of());
        }

        telemetry.startStep(RunTelemetry.STEP_DETAIL_FETCH);
        OfferDetailClient.FetchResult details = detailClient.fetchDetails(candidateIds);
        telemetry.endStep(RunTelemetry.STEP_DETAIL_FETCH, candidateIds.size(), details.records.size(),
                details.batchesAbandoned(), "attempts=" + details.attempts + " rate_limited=" + details.rateLimitedReplies);
        if (!details.abandonedIds.isEmpty()) {
            LOG.warn("{} candidate id(s) left unseen for the next run after abandoned batches",
                    details.abandonedIds.size());
        }

        telemetry.startStep(RunTelemetry.STEP_MATCH);
        List<OfferRecord> matches = matchFilter.filter(details.records, seenSet);
        telemetry.endStep(RunTelemetry.STEP_MATCH, details.records.size(), matches.size(), 0);
        telemetry.setDealStats(feed.records.size(), candidateIds.size(), matches.size(), details.abandonedIds.size());

        List<String> enrichedIds = new ArrayList<>(details.records.size());
        for (OfferRecord record : details.records) {
            if (record.hasId()) {
                enrichedIds.add(record.id);
            }
        }

        String deferred = details.abandonedIds.isEmpty() ? ""
                : "; " + details.abandonedIds.size() + " id(s) deferred after abandoned batches";
        if (matches.isEmpty()) {
            return commit(telemetry, storeAvailable, seenSet, enrichedIds, PipelineOutcome.Status.NO_MATCHES,
                    "No new matching deals among " + candidateIds.size() + " candidate(s)" + deferred,
                    feed.records.size(), candidateIds.size(), details.records.size(),
                    details.abandonedIds.size(), List.of());
        }

        telemetry.startStep(RunTelemetry.STEP_MAIL_SEND);
        boolean notified;
        try {
            notified = notifier.send(matches);
        } catch (RuntimeException e) {
            LOG.error("Notifier threw while sending {} deal(s)", matches.size(), e);
            notified = false;
        }
        telemetry.endStep(RunTelemetry.STEP_MAIL_SEND, matches.size(), notified ? matches.size() : 0, notified ? 0 : 1);
        if (!notified) {
            LOG.error("Notification failed for {} deal(s); seen set left unchanged", matches.size());
            return new PipelineOutcome(PipelineOutcome.Status.NOTIFY_FAILED,
                    "Failed to send notification for " + matches.size() + " deal(s)",
                    feed.records.size(), candidateIds.size(), details.records.size(),
                    details.abandonedIds.size(), 0, matches, telemetry);
        }

        List<String> toMark = new ArrayList<>(matches.size() + enrichedIds.size());
        for (OfferRecord match : matches) {
            toMark.add(match.id);
        }
        toMark.addAll(enrichedIds);
        return commit(telemetry, storeAvailable, seenSet, toMark, PipelineOutcome.Status.NOTIFIED,
                "Found and notified about " + matches.size() + " new deal(s)" + deferred,
                feed.records.size(), candidateIds.size(), details.records.size(),
                details.abandonedIds.size(), matches);
    }

    private PipelineOutcome commit(
            RunTelemetry telemetry,
            boolean storeAvailable,
            SeenSet seenSet,
            List<String> ids,
            PipelineOutcome.Status status,
            String summary,
            int feedItems,
            int candidates,
            int enriched,
            int abandoned,
            List<OfferRecord> matches
    ) {
        telemetry.startStep(RunTelemetry.STEP_SEEN_COMMIT);
        if (!storeAvailable) {
            // Saving a set rebuilt from empty would wipe the stored ids.
            telemetry.endStep(RunTelemetry.STEP_SEEN_COMMIT, ids.size(), 0, 1, "store unavailable");
            return new PipelineOutcome(PipelineOutcome.Status.COMMIT_FAILED,
                    summary + "; seen set unavailable, state not saved",
                    feedItems, candidates, enriched, abandoned, 0, matches, telemetry);
        }
        SeenSet updated = seenSet.copy();
        int added = updated.addAll(ids);
        if (added == 0) {
            telemetry.endStep(RunTelemetry.STEP_SEEN_COMMIT, ids.size(), 0, 0, "unchanged");
            return new PipelineOutcome(status, summary, feedItems, candidates, enriched, abandoned, 0, matches, telemetry);
        }
        try {
            seenStore.save(updated);
        } catch (SeenSetStoreException e) {
            telemetry.endStep(RunTelemetry.STEP_SEEN_COMMIT, ids.size(), 0, 1, describe(e));
            LOG.error("Failed to persist {} new seen id(s) to {}", added, seenStore.describe(), e);
            return new PipelineOutcome(PipelineOutcome.Status.COMMIT_FAILED,
                    summary + "; seen set not saved: " + describe(e),
                    feedItems, candidates, enriched, abandoned, 0, matches, telemetry);
        }
        telemetry.endStep(RunTelemetry.STEP_SEEN_COMMIT, ids.size(), added, 0);
        return new PipelineOutcome(status, summary, feedItems, candidates, enriched, abandoned, added, matches, telemetry);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
