package com.dealwatch.app;

import com.dealwatch.config.Config;
import com.dealwatch.config.DealWatchSettings;
import com.dealwatch.runner.PipelineOutcome;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

public final class DealWatchApplication {
    private static final DateTimeFormatter DISPLAY_TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z")
            .withZone(ZoneId.systemDefault());
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final Map<String, String> env;
    private final Function<Config, PipelineFactory> factoryProvider;
    private final ReentrantLock runLock = new ReentrantLock();

    public DealWatchApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), System.getenv(), PipelineFactory::new);
    }

    DealWatchApplication(Path workingDir, Map<String, String> env, Function<Config, PipelineFactory> factoryProvider) {
        this.workingDir = workingDir;
        this.env = env;
        this.factoryProvider = factoryProvider;
    }

    public static void main(String[] args) {
        int exit = new DealWatchApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("dealwatch", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("dealwatch", options);
            return 0;
        }
        if (cmd.hasOption("loop") && cmd.hasOption("check")) {
            System.err.println("ERROR: --loop and --check cannot be combined.");
            return 2;
        }

        Path explicitConfig = cmd.hasOption("config") ? Path.of(cmd.getOptionValue("config")) : null;
        if (explicitConfig != null && !Files.isRegularFile(workingDir.resolve(explicitConfig))) {
            System.err.println("ERROR: config file not found: " + explicitConfig);
            return 2;
        }

        Config config = Config.load(workingDir, explicitConfig, env);
        if (cmd.hasOption("dry-run")) {
            config = config.with("mail.dry_run", "true");
        }
        installLogRoutingIfNeeded(config);

        PipelineFactory created;
        try {
            created = factoryProvider.apply(config);
        } catch (RuntimeException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return 2;
        }

        try (PipelineFactory factory = created) {
            if (cmd.hasOption("check")) {
                return runChecks(factory, cmd.getOptionValue("check"));
            }

            List<String> missing = factory.settings().missingRequired();
            if (!missing.isEmpty()) {
                System.err.println("ERROR: missing required settings: " + String.join(", ", missing));
                return 2;
            }

            if (cmd.hasOption("loop")) {
                return runLoop(factory);
            }
            return runOnce(factory, "manual");
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (DealWatchApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("dealwatch.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(DealWatchApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    int runChecks(PipelineFactory factory, String mode) {
        List<SelfCheck.Result> results;
        try {
            results = new SelfCheck(factory).run(mode);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }
        boolean allOk = true;
        for (SelfCheck.Result result : results) {
            System.out.println(result.line());
            allOk &= result.ok;
        }
        return allOk ? 0 : 1;
    }

    int runOnce(PipelineFactory factory, String trigger) {
        boolean locked = runLock.tryLock();
        if (!locked) {
            System.out.println("Run skipped. trigger=" + trigger + ", reason=run_lock_busy");
            return 0;
        }
        try {
            PipelineOutcome outcome = factory.pipeline().run(trigger.equals("manual") ? "ONCE" : "LOOP", trigger);
            System.out.println(outcome.status + ": " + outcome.summary);
            return outcome.exitCode();
        } catch (RuntimeException e) {
            System.err.println("ERROR: run failed: " + e.getMessage());
            return 1;
        } finally {
            runLock.unlock();
        }
    }

    private int runLoop(PipelineFactory factory) {
        DealWatchSettings settings = factory.settings();
        Duration interval = Duration.ofMinutes(Math.max(1, settings.scheduleIntervalMinutes));
        System.out.println("Schedule mode started. interval_minutes=" + interval.toMinutes());
        while (true) {
            int exit = runOnce(factory, "schedule");
            if (exit != 0) {
                System.err.println("WARN: scheduled run failed. exit=" + exit);
            }
            Instant next = Instant.now().plus(interval);
            System.out.println("Next run at " + DISPLAY_TS_FMT.format(next));
            if (!sleepUntil(next)) {
                return 130;
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("once").desc("run the pipeline once (default)").build());
        options.addOption(Option.builder().longOpt("loop").desc("run every schedule.interval_minutes until interrupted").build());
        options.addOption(Option.builder().longOpt("check").hasArg().argName("mode").desc("self-check: env|storage|api|email|all").build());
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path").desc("extra properties file layered over config.properties").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("write the alert mail to mail.dry_run.dir instead of sending").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private boolean sleepUntil(Instant next) {
        while (true) {
            long millis = Duration.between(Instant.now(), next).toMillis();
            if (millis <= 0) {
                return true;
            }
            long chunk = Math.min(30_000L, millis);
            try {
                Thread.sleep(chunk);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }
}
