package com.dealwatch.runner;

import com.dealwatch.core.RunTelemetry;
import com.dealwatch.model.OfferRecord;

import java.util.List;

/**
 * Result of one pipeline run. Every path through {@link DealPipeline#run()} ends in one of these.
 */
public final class PipelineOutcome {

    public enum Status {
        NO_FEED_DATA(true),
        NO_MATCHES(true),
        NOTIFIED(true),
        NOTIFY_FAILED(false),
        COMMIT_FAILED(false),
        FAILED(false);

        private final boolean success;

        Status(boolean success) {
            this.success = success;
        }

        public boolean isSuccess() {
            return success;
        }
    }

    public final Status status;
    public final String summary;
    public final int feedItems;
    public final int candidates;
    public final int enriched;
    public final int abandonedIds;
    public final int seenAdded;
    public final List<OfferRecord> matches;
    public final RunTelemetry telemetry;

    public PipelineOutcome(
            Status status,
            String summary,
            int feedItems,
            int candidates,
            int enriched,
            int abandonedIds,
            int seenAdded,
            List<OfferRecord> matches,
            RunTelemetry telemetry
    ) {
        this.status = status;
        this.summary = summary == null ? "" : summary;
        this.feedItems = Math.max(0, feedItems);
        this.candidates = Math.max(0, candidates);
        this.enriched = Math.max(0, enriched);
        this.abandonedIds = Math.max(0, abandonedIds);
        this.seenAdded = Math.max(0, seenAdded);
        this.matches = matches == null ? List.of() : List.copyOf(matches);
        this.telemetry = telemetry;
    }

    public static PipelineOutcome failed(String summary, RunTelemetry telemetry) {
        return new PipelineOutcome(Status.FAILED, summary, 0, 0, 0, 0, 0, List.of(), telemetry);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }

    @Override
    public String toString() {
        return status + ": " + summary;
    }
}
