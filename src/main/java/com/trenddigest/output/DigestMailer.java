package com.trenddigest.output;

import com.trenddigest.core.retry.CallOutcome;
import com.trenddigest.core.retry.RetryExecutor;
import com.trenddigest.core.retry.RetryPolicy;
import com.trenddigest.core.retry.Sleeper;
import com.trenddigest.model.TopicBatch;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * SMTP delivery of the digest mail.
 *
 * <p>Every attempt opens its own transport, authenticates, sends and closes it again, whatever happens in between.
 * Any {@link MessagingException} is retried until the attempt budget is spent; the wait between attempts is
 * {@code email.retry_delay_ms}, zero unless configured.
 */
public final class DigestMailer implements Notifier {
    private static final Logger LOG = LogManager.getLogger(DigestMailer.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final MailSettings settings;
    private final DigestMailRenderer renderer;
    private final MailTransportFactory transportFactory;
    private final RetryExecutor retry;
    private final Clock clock;

    public DigestMailer(MailSettings settings) {
        this(settings, MailTransportFactory.SESSION, Sleeper.THREAD, Clock.systemDefaultZone());
    }

    public DigestMailer(MailSettings settings, MailTransportFactory transportFactory, Sleeper sleeper, Clock clock) {
        this.settings = settings;
        this.renderer = new DigestMailRenderer(settings.subjectPrefix);
        this.transportFactory = transportFactory;
        this.retry = new RetryExecutor(
                "deliver",
                new RetryPolicy(Math.max(1, settings.maxAttempts), Duration.ofMillis(Math.max(0L, settings.retryDelayMs))),
                sleeper
        );
        this.clock = clock;
    }

    @Override
    public void deliver(String summary, TopicBatch batch) throws DeliveryException {
        RenderedDigest digest = renderer.render(summary, batch, ZonedDateTime.now(clock));

        if (settings.dryRun) {
            writeDryRun(digest);
            return;
        }
        if (isBlank(settings.host) || isBlank(settings.user) || isBlank(settings.pass)
                || settings.to == null || settings.to.isEmpty()) {
            throw new DeliveryException("smtp settings incomplete: host, user, password and recipients are required");
        }

        Session session = Session.getInstance(sessionProperties());
        MimeMessage message;
        try {
            message = buildMessage(session, digest);
        } catch (MessagingException e) {
            throw new DeliveryException("failed to build mail message: " + e.getMessage(), e);
        }

        CallOutcome<Boolean> outcome = retry.execute(attemptIndex -> transmit(session, message, attemptIndex));
        if (!outcome.isSuccess()) {
            throw new DeliveryException("mail delivery failed smtp=" + settings.host + ":" + settings.port
                    + " to=" + maskAddresses(settings.to) + " err=" + outcome.reason, outcome.cause);
        }
        LOG.info("Mail sent: subject=\"{}\" to={} rows={}", digest.subject(), maskAddresses(settings.to), digest.rowCount());
    }

    private CallOutcome<Boolean> transmit(Session session, MimeMessage message, int attemptIndex) {
        LOG.info("Sending mail, attempt {} via {}://{}:{}", attemptIndex + 1, settings.protocol(), settings.host, settings.port);
        Transport transport = null;
        try {
            transport = transportFactory.open(session, settings.protocol());
            transport.connect(settings.host, settings.port, settings.user, settings.pass);
            transport.sendMessage(message, message.getAllRecipients());
            return CallOutcome.success(Boolean.TRUE);
        } catch (MessagingException e) {
            return CallOutcome.retryable(describe(e), retry.policy().baseDelay(), e);
        } finally {
            close(transport);
        }
    }

    private void close(Transport transport) {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (MessagingException e) {
            // The attempt's verdict is already decided; a failed QUIT does not change it.
            LOG.warn("Failed to close smtp transport: {}", e.getMessage());
        }
    }

    Properties sessionProperties() {
        String proto = settings.protocol();
        String timeoutMs = String.valueOf(settings.timeoutSec * 1000L);
        Properties props = new Properties();
        props.put("mail.transport.protocol", proto);
        props.put("mail." + proto + ".host", settings.host);
        props.put("mail." + proto + ".port", String.valueOf(settings.port));
        props.put("mail." + proto + ".auth", "true");
        props.put("mail." + proto + ".connectiontimeout", timeoutMs);
        props.put("mail." + proto + ".timeout", timeoutMs);
        props.put("mail." + proto + ".writetimeout", timeoutMs);
        if (settings.implicitTls()) {
            props.put("mail.smtps.ssl.enable", "true");
        } else {
            props.put("mail.smtp.starttls.enable", "true");
        }
        return props;
    }

    MimeMessage buildMessage(Session session, RenderedDigest digest) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(isBlank(settings.from) ? settings.user : settings.from));
        String toJoined = settings.to.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.joining(","));
        message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(toJoined));
        message.setSubject(digest.subject(), "UTF-8");
        message.setSentDate(Date.from(clock.instant()));

        MimeMultipart alternative = new MimeMultipart("alternative");
        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(digest.textBody(), "UTF-8");
        alternative.addBodyPart(textPart);

        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setContent(digest.htmlBody(), "text/html; charset=UTF-8");
        alternative.addBodyPart(htmlPart);

        message.setContent(alternative);
        message.saveChanges();
        return message;
    }

    private void writeDryRun(RenderedDigest digest) throws DeliveryException {
        try {
            Path dir = settings.dryRunDir;
            Files.createDirectories(dir);
            String stamp = STAMP.format(ZonedDateTime.now(clock));
            String eml = "From: " + safe(settings.from) + "\n"
                    + "To: " + (settings.to == null ? "" : String.join(",", settings.to)) + "\n"
                    + "Subject: " + digest.subject() + "\n"
                    + "MIME-Version: 1.0\n"
                    + "Content-Type: text/html; charset=UTF-8\n\n"
                    + digest.htmlBody();
            Files.writeString(dir.resolve("mail_" + stamp + ".eml"), eml, StandardCharsets.UTF_8);
            Files.writeString(dir.resolve("mail_" + stamp + ".html"), digest.htmlBody(), StandardCharsets.UTF_8);
            Files.writeString(dir.resolve("mail_" + stamp + ".txt"), digest.textBody(), StandardCharsets.UTF_8);
            LOG.info("Mail dry-run saved. dir={}", dir.toAbsolutePath());
        } catch (IOException e) {
            throw new DeliveryException("mail dry-run write failed: " + e.getMessage(), e);
        }
    }

    private static String describe(MessagingException e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getClass().getSimpleName();
        }
        Exception next = e.getNextException();
        if (next != null && next.getMessage() != null) {
            message = message + " (" + next.getMessage() + ")";
        }
        return message;
    }

    public static String maskAddresses(List<String> to) {
        if (to == null || to.isEmpty()) {
            return "";
        }
        return to.stream().map(DigestMailer::maskAddress).collect(Collectors.joining(","));
    }

    static String maskAddress(String raw) {
        String value = safe(raw).trim();
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        if (local.length() <= 1) {
            return "*@" + domain;
        }
        return local.substring(0, 1) + "***@" + domain;
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
