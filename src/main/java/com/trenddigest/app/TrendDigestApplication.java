package com.trenddigest.app;

import com.trenddigest.config.Config;
import com.trenddigest.config.ConfigMissingException;
import com.trenddigest.core.PipelineResult;
import com.trenddigest.core.retry.RetryPolicy;
import com.trenddigest.core.retry.Sleeper;
import com.trenddigest.data.WeiboHotSearchClient;
import com.trenddigest.data.http.HttpClientEx;
import com.trenddigest.output.AuditWriter;
import com.trenddigest.output.DigestMailer;
import com.trenddigest.output.MailSettings;
import com.trenddigest.pipeline.DigestPipeline;
import com.trenddigest.summary.ChatModelFactory;
import com.trenddigest.summary.TrendSummarizer;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry: one run of the hot-search digest, exit 0 when delivered, 1 otherwise.
 */
public final class TrendDigestApplication {
    private static final DateTimeFormatter DISPLAY_TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new TrendDigestApplication().run();
        System.exit(exit);
    }

    public int run() {
        Config config = Config.load(Path.of(".").toAbsolutePath().normalize());
        installLogRoutingIfNeeded(config);
        Logger log = LogManager.getLogger(TrendDigestApplication.class);
        log.info("Hot-search digest run started at {}", DISPLAY_TS_FMT.format(ZonedDateTime.now()));

        List<String> required = requiredKeys(config);
        try {
            config.requireAll(required);
        } catch (ConfigMissingException e) {
            log.error("Precondition failed, no stage was run: {}", e.getMessage());
            return 1;
        }
        for (String key : required) {
            log.info("config {} from {}", key, config.sourceOf(key));
        }

        PipelineResult result;
        try {
            result = buildPipeline(config).run();
        } catch (RuntimeException e) {
            log.error("Failed to assemble pipeline: {}", e.getMessage(), e);
            return 1;
        }

        if (result.delivered()) {
            log.info("Digest delivered to {}", DigestMailer.maskAddresses(config.getList("email.to")));
        } else {
            log.error("Digest not delivered, aborted at stage={} reason={}", result.abortedAt().label(), result.reason());
        }
        return result.exitCode();
    }

    static List<String> requiredKeys(Config config) {
        List<String> keys = new ArrayList<>();
        keys.add("topic.api_key");
        if (ChatModelFactory.PROVIDER_OPENAI.equals(ChatModelFactory.provider(config))) {
            keys.add("summarizer.api_key");
        }
        if (!config.getBoolean("mail.dry_run", false)) {
            keys.add("email.smtp_user");
            keys.add("email.smtp_pass");
            keys.add("email.to");
        }
        return keys;
    }

    static DigestPipeline buildPipeline(Config config) {
        Clock clock = Clock.systemDefaultZone();
        HttpClientEx http = new HttpClientEx();
        WeiboHotSearchClient source = new WeiboHotSearchClient(config, http);
        TrendSummarizer summarizer = new TrendSummarizer(
                ChatModelFactory.create(config),
                RetryPolicy.of(
                        Math.max(1, config.getInt("summarizer.max_attempts", 3)),
                        config.getLong("summarizer.base_delay_ms", 2000L)
                ),
                Sleeper.THREAD
        );
        DigestMailer mailer = new DigestMailer(MailSettings.load(config));
        AuditWriter audit = new AuditWriter(config.getPath("outputs.dir"), clock);
        return new DigestPipeline(source, summarizer, mailer, audit, config.getInt("topic.limit", 50));
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TrendDigestApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("trenddigest.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TrendDigestApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }
}
