package com.trenddigest.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @Test
    void load_shouldLetEnvironmentOverrideLocalFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("config.properties"),
                "topic.api_key=from-file\nemail.subject_prefix=热点速递\nemail.to=a@x.cn; b@y.cn\n",
                StandardCharsets.UTF_8);

        Config config = Config.load(dir, Map.of("TIANAPI_KEY", "from-env", "SMTP_PORT", "587"));

        assertEquals("from-env", config.getString("topic.api_key"));
        assertEquals("env", config.sourceOf("topic.api_key"));
        assertEquals(587, config.getInt("email.smtp_port", 465));
        assertEquals("热点速递", config.getString("email.subject_prefix"));
        assertEquals("file", config.sourceOf("email.subject_prefix"));
        assertEquals(List.of("a@x.cn", "b@y.cn"), config.getList("email.to"));
    }

    @Test
    void load_shouldFallBackToClasspathAndDefaults(@TempDir Path dir) {
        Config config = Config.load(dir, Map.of());

        assertEquals("classpath", config.sourceOf("topic.base_url"));
        assertEquals("微博热搜榜", config.getString("email.subject_prefix"));
        assertEquals("default", config.sourceOf("email.subject_prefix"));
        assertEquals("unset", config.sourceOf("topic.api_key"));
        assertEquals(dir.resolve("outputs/mail_dry_run").normalize(), config.getPath("mail.dry_run.dir"));
    }

    @Test
    void requireAll_shouldReportEveryMissingKey() {
        Config config = Config.fromMap(Path.of("."), Map.of("topic.api_key", "k"));

        ConfigMissingException error = assertThrows(ConfigMissingException.class,
                () -> config.requireAll(List.of("topic.api_key", "summarizer.api_key", "email.to", "email.from")));

        assertEquals(List.of("summarizer.api_key (env DEEPSEEK_API_KEY)", "email.to (env EMAIL_RECIPIENT)", "email.from"),
                error.missingKeys());
        assertTrue(error.getMessage().startsWith("missing required config: "));
    }

    @Test
    void getters_shouldFallBackOnBlankOrMalformedValues() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "summarizer.max_attempts", "three",
                "summarizer.temperature", "0.2",
                "mail.dry_run", "yes",
                "email.from", "  "
        ));

        assertEquals(3, config.getInt("summarizer.max_attempts", 3));
        assertEquals(0.2, config.getDouble("summarizer.temperature", 0.7), 1e-9);
        assertTrue(config.getBoolean("mail.dry_run", false));
        assertEquals("fallback", config.getString("email.from", "fallback"));
        assertEquals("map", config.sourceOf("mail.dry_run"));
    }
}
