package com.dealwatch.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 *
 * <p>Resolution order, lowest to highest: built-in defaults, classpath {@code config.properties},
 * {@code ./config.properties}, an explicitly passed file, then the environment variables listed in
 * {@link #ENV_OVERRIDES}.</p>
 */
public final class Config {

    static final Map<String, String> ENV_OVERRIDES = buildEnvOverrides();
    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Properties envProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, null, System.getenv());
    }

    public static Config load(Path workingDir, Path explicitFile, Map<String, String> env) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        config.loadOverrideFile(workingDir.resolve("config.properties"));
        if (explicitFile != null) {
            config.loadOverrideFile(workingDir.resolve(explicitFile).normalize());
        }

        if (env != null) {
            for (Map.Entry<String, String> entry : ENV_OVERRIDES.entrySet()) {
                String value = env.get(entry.getKey());
                if (value != null && !value.trim().isEmpty()) {
                    config.envProps.setProperty(entry.getValue(), value.trim());
                }
            }
            config.props.putAll(config.envProps);
        }
        return config;
    }

    /**
     * Build a Config from an in-memory map; used by tests and by callers that assemble settings
     * programmatically.
     */
    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                config.overrideProps.setProperty(entry.getKey().trim(), entry.getValue());
            }
            config.props.putAll(config.overrideProps);
        }
        return config;
    }

    private void loadOverrideFile(Path file) {
        if (!Files.exists(file)) {
            return;
        }
        try (InputStream in = Files.newInputStream(file)) {
            Properties loaded = new Properties();
            loaded.load(in);
            overrideProps.putAll(loaded);
            props.putAll(loaded);
        } catch (IOException e) {
            System.err.println("WARN: failed to read " + file + ": " + e.getMessage());
        }
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Returns a copy with one key overridden; the copy keeps this instance's source tracking.
     */
    public Config with(String key, String value) {
        Config copy = new Config(workingDir);
        copy.resourceProps.putAll(resourceProps);
        copy.overrideProps.putAll(overrideProps);
        copy.envProps.putAll(envProps);
        copy.props.putAll(props);
        copy.overrideProps.setProperty(key, value);
        copy.props.setProperty(key, value);
        return copy;
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(envProps.getProperty(key)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildEnvOverrides() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("WOOT_API_KEY", "woot.api_key");
        env.put("GMAIL_USER", "email.smtp_user");
        env.put("GMAIL_APP_PASSWORD", "email.smtp_pass");
        env.put("EMAIL_RECIPIENT", "email.to");
        env.put("BUCKET_NAME", "seen.bucket");
        env.put("AWS_REGION", "seen.region");
        return Collections.unmodifiableMap(env);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");

        defaults.put("woot.api_key", "");
        defaults.put("feed.endpoint", "https://developer.woot.com/feed");
        defaults.put("feed.category", "Electronics");
        defaults.put("feed.max_pages", "50");
        defaults.put("feed.timeout_sec", "20");

        defaults.put("detail.endpoint", "https://developer.woot.com/getoffers");
        defaults.put("detail.timeout_sec", "20");
        defaults.put("detail.batch_size", "20");
        defaults.put("detail.batch_delay_ms", "1000");
        defaults.put("detail.batch_jitter_ms", "500");
        defaults.put("detail.max_attempts", "5");
        defaults.put("detail.backoff_initial_ms", "2000");
        defaults.put("detail.backoff_max_ms", "30000");
        defaults.put("detail.backoff_jitter_ms", "1000");

        defaults.put("keywords", "kindle,ereader,e-reader,e-ink,kobo,nook,eink");

        defaults.put("seen.store", "s3");
        defaults.put("seen.bucket", "");
        defaults.put("seen.region", "us-east-1");
        defaults.put("seen.key", "seen_deals.json");
        defaults.put("seen.file", "outputs/seen_deals.json");

        defaults.put("email.enabled", "true");
        defaults.put("email.smtp_host", "smtp.gmail.com");
        defaults.put("email.smtp_port", "587");
        defaults.put("email.smtp_user", "");
        defaults.put("email.smtp_pass", "");
        defaults.put("email.from", "");
        defaults.put("email.to", "");
        defaults.put("email.subject_prefix", "Kindle Alert:");
        defaults.put("mail.dry_run", "false");
        defaults.put("mail.fail_fast", "false");
        defaults.put("mail.dry_run.dir", "outputs/mail_dry_run");

        defaults.put("schedule.interval_minutes", "30");

        return Collections.unmodifiableMap(defaults);
    }
}
