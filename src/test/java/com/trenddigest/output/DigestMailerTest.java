package com.trenddigest.output;

import com.trenddigest.core.retry.Sleeper;
import com.trenddigest.model.Topic;
import com.trenddigest.model.TopicBatch;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.URLName;
import jakarta.mail.internet.MimeMultipart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DigestMailerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-08T01:30:00Z"), ZoneId.of("Asia/Shanghai"));
    private static final TopicBatch BATCH = TopicBatch.of(List.of(
            new Topic("热", "话题一", "12345"),
            new Topic("", "话题二", "99")
    ));

    @Test
    void deliver_shouldRetryTransientFailureWithFreshSession() throws Exception {
        Script script = new Script();
        script.sendFailures = 1;
        RecordingSleeper sleeper = new RecordingSleeper();
        DigestMailer mailer = new DigestMailer(settings(3, 0L), script, sleeper, CLOCK);

        mailer.deliver("总结", BATCH);

        assertEquals(2, script.opened);
        assertEquals(2, script.connects);
        assertEquals(1, script.sent);
        assertEquals(2, script.closes);
        assertTrue(sleeper.waits.isEmpty());
        assertEquals("sender@example.com", script.lastUser);
    }

    @Test
    void deliver_shouldGiveUpAfterBudgetAndCloseEverySession() {
        Script script = new Script();
        script.sendFailures = 3;
        RecordingSleeper sleeper = new RecordingSleeper();
        DigestMailer mailer = new DigestMailer(settings(3, 500L), script, sleeper, CLOCK);

        DeliveryException error = assertThrows(DeliveryException.class, () -> mailer.deliver("总结", BATCH));

        assertTrue(error.getMessage().contains("gave up after 3 attempts"));
        assertTrue(error.getMessage().contains("r***@example.com"));
        assertEquals(3, script.opened);
        assertEquals(0, script.sent);
        assertEquals(3, script.closes);
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(500)), sleeper.waits);
    }

    @Test
    void deliver_shouldRetryAuthenticationFailureAndStillClose() {
        Script script = new Script();
        script.failConnect = true;
        DigestMailer mailer = new DigestMailer(settings(2, 0L), script, new RecordingSleeper(), CLOCK);

        assertThrows(DeliveryException.class, () -> mailer.deliver("总结", BATCH));

        assertEquals(2, script.connects);
        assertEquals(2, script.closes);
        assertEquals(0, script.sent);
    }

    @Test
    void deliver_shouldNotResendWhenCloseFailsAfterSend() throws Exception {
        Script script = new Script();
        script.failClose = true;
        DigestMailer mailer = new DigestMailer(settings(3, 0L), script, new RecordingSleeper(), CLOCK);

        mailer.deliver("总结", BATCH);

        assertEquals(1, script.opened);
        assertEquals(1, script.sent);
    }

    @Test
    void deliver_shouldSendAlternativeTextAndHtmlParts() throws Exception {
        Script script = new Script();
        DigestMailer mailer = new DigestMailer(settings(1, 0L), script, new RecordingSleeper(), CLOCK);

        mailer.deliver("总结", BATCH);

        Message message = script.lastMessage;
        assertEquals("微博热搜榜 - 2026-03-08", message.getSubject());
        MimeMultipart body = (MimeMultipart) message.getContent();
        assertEquals(2, body.getCount());
        assertTrue(body.getBodyPart(0).isMimeType("text/plain"));
        assertTrue(body.getBodyPart(1).isMimeType("text/html"));
        assertEquals(1, script.lastRecipients.length);
    }

    @Test
    void deliver_shouldRejectIncompleteSettingsWithoutConnecting() {
        Script script = new Script();
        MailSettings settings = settings(3, 0L);
        settings.pass = "";
        DigestMailer mailer = new DigestMailer(settings, script, new RecordingSleeper(), CLOCK);

        assertThrows(DeliveryException.class, () -> mailer.deliver("总结", BATCH));
        assertEquals(0, script.opened);
    }

    @Test
    void deliver_shouldWriteFilesInDryRunWithoutConnecting(@TempDir Path dir) throws Exception {
        Script script = new Script();
        MailSettings settings = settings(3, 0L);
        settings.dryRun = true;
        settings.dryRunDir = dir.resolve("dry");
        DigestMailer mailer = new DigestMailer(settings, script, new RecordingSleeper(), CLOCK);

        mailer.deliver("总结", BATCH);

        assertEquals(0, script.opened);
        Path eml = settings.dryRunDir.resolve("mail_20260308_093000.eml");
        assertTrue(Files.exists(eml));
        assertTrue(Files.exists(settings.dryRunDir.resolve("mail_20260308_093000.html")));
        String text = Files.readString(settings.dryRunDir.resolve("mail_20260308_093000.txt"), StandardCharsets.UTF_8);
        assertTrue(text.contains("话题一"));
        assertTrue(Files.readString(eml, StandardCharsets.UTF_8).contains("Subject: 微博热搜榜 - 2026-03-08"));
    }

    @Test
    void maskAddress_shouldHideLocalPart() {
        assertEquals("a***@example.com", DigestMailer.maskAddress("alice@example.com"));
        assertEquals("*@x.cn", DigestMailer.maskAddress("b@x.cn"));
        assertEquals("a***@x.cn,*@y.cn", DigestMailer.maskAddresses(List.of("ann@x.cn", "c@y.cn")));
    }

    private static MailSettings settings(int maxAttempts, long retryDelayMs) {
        MailSettings s = new MailSettings();
        s.host = "localhost";
        s.port = 465;
        s.user = "sender@example.com";
        s.pass = "app-password";
        s.from = "sender@example.com";
        s.to = List.of("reader@example.com");
        s.subjectPrefix = "微博热搜榜";
        s.maxAttempts = maxAttempts;
        s.retryDelayMs = retryDelayMs;
        s.timeoutSec = 5;
        return s;
    }

    private static final class Script implements MailTransportFactory {
        int opened;
        int connects;
        int sent;
        int closes;
        int sendFailures;
        boolean failConnect;
        boolean failClose;
        String lastUser;
        Message lastMessage;
        Address[] lastRecipients;

        @Override
        public Transport open(Session session, String protocol) {
            opened++;
            return new FakeTransport(session, this);
        }
    }

    private static final class FakeTransport extends Transport {
        private final Script script;

        private FakeTransport(Session session, Script script) {
            super(session, new URLName("smtps", "localhost", 465, null, null, null));
            this.script = script;
        }

        @Override
        protected boolean protocolConnect(String host, int port, String user, String password) throws MessagingException {
            script.connects++;
            script.lastUser = user;
            if (script.failConnect) {
                throw new AuthenticationFailedException("535 authentication failed");
            }
            return true;
        }

        @Override
        public void sendMessage(Message message, Address[] addresses) throws MessagingException {
            if (script.sendFailures > 0) {
                script.sendFailures--;
                throw new MessagingException("421 service not available, try later");
            }
            script.sent++;
            script.lastMessage = message;
            script.lastRecipients = addresses;
        }

        @Override
        public synchronized void close() throws MessagingException {
            script.closes++;
            super.close();
            if (script.failClose) {
                throw new MessagingException("QUIT failed");
            }
        }
    }

    private static final class RecordingSleeper implements Sleeper {
        private final List<Duration> waits = new ArrayList<>();

        @Override
        public void sleep(Duration duration) {
            waits.add(duration);
        }
    }
}
