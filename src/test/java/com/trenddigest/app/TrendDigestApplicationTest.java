package com.trenddigest.app;

import com.trenddigest.config.Config;
import com.trenddigest.output.DigestMailer;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TrendDigestApplicationTest {

    @Test
    void requiredKeys_shouldAskForEverySecretByDefault() {
        Config config = Config.fromMap(Path.of("."), Map.of());

        assertEquals(
                List.of("topic.api_key", "summarizer.api_key", "email.smtp_user", "email.smtp_pass", "email.to"),
                TrendDigestApplication.requiredKeys(config)
        );
    }

    @Test
    void requiredKeys_shouldSkipMailCredentialsInDryRunAndApiKeyForOllama() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "mail.dry_run", "true",
                "summarizer.provider", "Ollama"
        ));

        assertEquals(List.of("topic.api_key"), TrendDigestApplication.requiredKeys(config));
    }

    @Test
    void deliveredLog_shouldMaskConfiguredRecipients() {
        Config config = Config.fromMap(Path.of("."), Map.of("email.to", "alice@example.com, b@x.cn"));

        assertEquals("a***@example.com,*@x.cn", DigestMailer.maskAddresses(config.getList("email.to")));
    }

    @Test
    void buildPipeline_shouldRejectUnknownProvider() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "topic.api_key", "k",
                "summarizer.provider", "bard"
        ));

        assertThrows(IllegalArgumentException.class, () -> TrendDigestApplication.buildPipeline(config));
    }
}
