package com.trenddigest.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
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
 * Files are read as UTF-8. Lookup order: environment alias, working-directory config.properties, classpath config.properties, built-in defaults.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_ALIASES = buildEnvAliases();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Properties envProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> environment) {
        Config config = new Config(workingDir);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                config.resourceProps.load(new InputStreamReader(in, StandardCharsets.UTF_8));
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (Reader in = Files.newBufferedReader(local, StandardCharsets.UTF_8)) {
                config.overrideProps.load(in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        config.applyEnvironment(environment);
        return config;
    }

    /**
     * Build Config from an in-memory map, without touching classpath, disk or environment.
     */
    public static Config fromMap(Path workingDir, Map<String, String> values) {
        Config config = new Config(workingDir);
        if (values != null) {
            values.forEach((key, value) -> {
                if (key != null && value != null) {
                    config.props.setProperty(key, value);
                }
            });
        }
        return config;
    }

    private void applyEnvironment(Map<String, String> environment) {
        if (environment == null || environment.isEmpty()) {
            return;
        }
        for (Map.Entry<String, String> alias : ENV_ALIASES.entrySet()) {
            String value = nonBlank(environment.get(alias.getValue()));
            if (!value.isEmpty()) {
                envProps.setProperty(alias.getKey(), value);
            }
        }
        props.putAll(envProps);
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
        String raw = props.getProperty(key);
        if ((raw == null || raw.trim().isEmpty()) && !DEFAULTS.containsKey(key)) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    /**
     * Comma or semicolon separated list, blanks dropped.
     */
    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : value.split("[,;]")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new ConfigMissingException(List.of(describe(key)));
        }
        return value;
    }

    /**
     * Fails with every missing key at once so the operator can fix them in one pass.
     */
    public void requireAll(List<String> keys) {
        List<String> missing = new ArrayList<>();
        for (String key : keys) {
            if (getString(key).isEmpty()) {
                missing.add(describe(key));
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigMissingException(missing);
        }
    }

    /**
     * Reports which layer supplied the value of a key.
     */
    public String sourceOf(String key) {
        if (!nonBlank(envProps.getProperty(key)).isEmpty()) {
            return "env";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "file";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "classpath";
        }
        if (!nonBlank(props.getProperty(key)).isEmpty()) {
            return "map";
        }
        if (DEFAULTS.containsKey(key)) {
            return "default";
        }
        return "unset";
    }

    private String describe(String key) {
        String env = ENV_ALIASES.get(key);
        return env == null ? key : key + " (env " + env + ")";
    }

    private static String nonBlank(String raw) {
        return raw == null ? "" : raw.trim();
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static Map<String, String> buildEnvAliases() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("topic.api_key", "TIANAPI_KEY");
        aliases.put("summarizer.api_key", "DEEPSEEK_API_KEY");
        aliases.put("summarizer.base_url", "DEEPSEEK_BASE_URL");
        aliases.put("summarizer.model", "DEEPSEEK_MODEL");
        aliases.put("email.smtp_host", "SMTP_SERVER");
        aliases.put("email.smtp_port", "SMTP_PORT");
        aliases.put("email.smtp_user", "EMAIL_SENDER");
        aliases.put("email.smtp_pass", "EMAIL_PASSWORD");
        aliases.put("email.to", "EMAIL_RECIPIENT");
        return Collections.unmodifiableMap(aliases);
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();
        defaults.put("outputs.dir", "outputs");

        defaults.put("topic.base_url", "https://apis.tianapi.com/weibohot/index");
        defaults.put("topic.limit", "50");
        defaults.put("topic.timeout_sec", "10");

        defaults.put("summarizer.provider", "openai");
        defaults.put("summarizer.base_url", "https://api.deepseek.com");
        defaults.put("summarizer.model", "deepseek-chat");
        defaults.put("summarizer.temperature", "0.7");
        defaults.put("summarizer.max_tokens", "1000");
        defaults.put("summarizer.timeout_sec", "60");
        defaults.put("summarizer.max_attempts", "3");
        defaults.put("summarizer.base_delay_ms", "2000");
        defaults.put("summarizer.ollama.base_url", "http://127.0.0.1:11434");
        defaults.put("summarizer.ollama.model", "qwen2.5:7b");

        defaults.put("email.smtp_host", "smtp.163.com");
        defaults.put("email.smtp_port", "465");
        defaults.put("email.subject_prefix", "微博热搜榜");
        defaults.put("email.max_attempts", "3");
        defaults.put("email.retry_delay_ms", "0");
        defaults.put("email.timeout_sec", "30");

        defaults.put("mail.dry_run", "false");
        defaults.put("mail.dry_run.dir", "outputs/mail_dry_run");
        return Collections.unmodifiableMap(defaults);
    }
}
