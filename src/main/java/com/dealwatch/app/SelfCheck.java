package com.dealwatch.app;

import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.feed.FeedClient;
import com.dealwatch.feed.OfferDetailClient;
import com.dealwatch.output.Mailer;
import com.dealwatch.state.SeenSetStore;
import jakarta.mail.MessagingException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deployment self-checks run by {@code --check}.
 */
public final class SelfCheck {
    public static final List<String> MODES = List.of("env", "storage", "api", "email");

    private final PipelineFactory factory;

    public SelfCheck(PipelineFactory factory) {
        this.factory = factory;
    }

    public static final class Result {
        public final String mode;
        public final boolean ok;
        public final String detail;

        private Result(String mode, boolean ok, String detail) {
            this.mode = mode;
            this.ok = ok;
            this.detail = detail == null ? "" : detail;
        }

        static Result ok(String mode, String detail) {
            return new Result(mode, true, detail);
        }

        static Result fail(String mode, String detail) {
            return new Result(mode, false, detail);
        }

        public String line() {
            return "CHECK " + mode + " " + (ok ? "OK" : "FAIL") + (detail.isEmpty() ? "" : " " + detail);
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown mode
     */
    public List<Result> run(String mode) {
        String normalized = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
        List<Result> out = new ArrayList<>();
        if (normalized.equals("all")) {
            for (String m : MODES) {
                out.add(runOne(m));
            }
            return out;
        }
        if (!MODES.contains(normalized)) {
            throw new IllegalArgumentException("unknown check mode: " + mode + " (use env|storage|api|email|all)");
        }
        out.add(runOne(normalized));
        return out;
    }

    private Result runOne(String mode) {
        try {
            switch (mode) {
                case "env":
                    return checkEnv();
                case "storage":
                    return checkStorage();
                case "api":
                    return checkApi();
                default:
                    return checkEmail();
            }
        } catch (RuntimeException e) {
            return Result.fail(mode, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    Result checkEnv() {
        DealWatchSettings settings = factory.settings();
        List<String> missing = new ArrayList<>(settings.missingRequired());
        Mailer.Settings mail = factory.mailSettings();
        if (mail.enabled && !mail.dryRun) {
            if (isBlank(mail.user)) {
                missing.add("email.smtp_user");
            }
            if (isBlank(mail.pass)) {
                missing.add("email.smtp_pass");
            }
            if (mail.to == null || mail.to.isEmpty()) {
                missing.add("email.to");
            }
        }
        if (!missing.isEmpty()) {
            return Result.fail("env", "missing=" + String.join(",", missing));
        }
        return Result.ok("env", "seen.store=" + settings.seenStore + " keywords=" + settings.keywords.size());
    }

    Result checkStorage() {
        SeenSetStore store = factory.seenSetStore();
        SeenSetStore.LoadResult loaded = store.load();
        if (!loaded.success) {
            return Result.fail("storage", store.describe() + " " + loaded.error);
        }
        return Result.ok("storage", store.describe() + " ids=" + loaded.seenSet.size()
                + (loaded.existed ? "" : " (absent, starts empty)"));
    }

    Result checkApi() {
        FeedClient.FetchResult feed = factory.feedClient().fetchFirstPage();
        if (feed.partial || feed.isEmpty()) {
            return Result.fail("api", "feed page 1 unavailable" + (feed.error.isEmpty() ? "" : ": " + feed.error));
        }
        String probeId = feed.records.get(0).id;
        OfferDetailClient.FetchResult details = factory.probeDetailClient().fetchDetails(List.of(probeId));
        if (details.batchesSucceeded != 1) {
            return Result.fail("api", "detail request for " + probeId + " failed");
        }
        return Result.ok("api", "feed_items=" + feed.records.size() + " detail_records=" + details.records.size());
    }

    Result checkEmail() {
        Mailer.Settings mail = factory.mailSettings();
        try {
            boolean sent = factory.mailer().send(mail,
                    mail.subjectPrefix + " test message",
                    "This is a test message from the deal alert system.",
                    "<p>This is a test message from the deal alert system.</p>");
            return sent ? Result.ok("email", mail.dryRun ? "dry_run" : "sent") : Result.fail("email", "send returned false");
        } catch (MessagingException e) {
            return Result.fail("email", e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
