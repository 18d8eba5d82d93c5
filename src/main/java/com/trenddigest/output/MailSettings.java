package com.trenddigest.output;

import com.trenddigest.config.Config;

import java.nio.file.Path;
import java.util.List;

/**
 * SMTP and delivery settings.
 */
public final class MailSettings {
    public static final int IMPLICIT_TLS_PORT = 465;

    public String host;
    public int port;
    public String user;
    public String pass;
    public String from;
    public List<String> to;
    public String subjectPrefix;
    public int maxAttempts;
    public long retryDelayMs;
    public int timeoutSec;
    public boolean dryRun;
    public Path dryRunDir;

    public static MailSettings load(Config config) {
        MailSettings s = new MailSettings();
        s.host = config.getString("email.smtp_host");
        s.port = config.getInt("email.smtp_port", IMPLICIT_TLS_PORT);
        s.user = config.getString("email.smtp_user");
        s.pass = config.getString("email.smtp_pass");
        s.from = config.getString("email.from", s.user);
        s.to = config.getList("email.to");
        s.subjectPrefix = config.getString("email.subject_prefix");
        s.maxAttempts = Math.max(1, config.getInt("email.max_attempts", 3));
        s.retryDelayMs = Math.max(0L, config.getLong("email.retry_delay_ms", 0L));
        s.timeoutSec = Math.max(1, config.getInt("email.timeout_sec", 30));
        s.dryRun = config.getBoolean("mail.dry_run", false);
        s.dryRunDir = config.getPath("mail.dry_run.dir");
        return s;
    }

    /**
     * Port 465 speaks TLS from the first byte; anything else upgrades with STARTTLS.
     */
    public boolean implicitTls() {
        return port == IMPLICIT_TLS_PORT;
    }

    public String protocol() {
        return implicitTls() ? "smtps" : "smtp";
    }
}
