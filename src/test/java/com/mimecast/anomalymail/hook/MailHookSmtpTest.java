package com.mimecast.anomalymail.hook;

import com.mimecast.anomalymail.config.ConfigException;
import com.mimecast.anomalymail.config.ConfigLoader;
import com.mimecast.anomalymail.config.ConfigValidator;
import com.mimecast.anomalymail.config.MailPlugin;
import com.mimecast.anomalymail.mail.DeliveryFailure;
import com.mimecast.anomalymail.mail.DeliveryResult;
import com.mimecast.anomalymail.mail.SmtpMailSender;
import com.mimecast.anomalymail.mail.SmtpMockServer;
import com.mimecast.anomalymail.main.Config;
import com.mimecast.anomalymail.template.EventKind;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End to end tests for MailHook delivering through SmtpMailSender to a mock SMTP server.
 */
class MailHookSmtpTest {

    private static final Instant DATE = Instant.parse("2024-03-07T09:11:12Z");

    private SmtpMockServer server;

    @BeforeEach
    void setUp() {
        server = new SmtpMockServer();
        assertTrue(server.start(), "Mock server should start");
    }

    @AfterEach
    void tearDown() {
        server.stop();
        Config.setPlugin(null);
    }

    private MailHook mailHook(String smtp) throws ConfigException {
        Config.setPlugin(MailPlugin.fromConfig(ConfigLoader.parse("plugin", "{ smtp: " + smtp + " }")));

        Map<String, Object> hook = ConfigLoader.parse("hook", "{" +
                "  from: { name: 'Monitoring', address: 'monitoring@example.com' }," +
                "  to: { address: 'oncall@example.com' }" +
                "}");
        return new MailHook("mail", ConfigValidator.validateHook(hook),
                new SmtpMailSender(), Config::getPlugin, ZoneOffset.UTC);
    }

    private static AnomalyEvent startEvent() {
        return AnomalyEvent.start("cpu", DATE, 0.91)
                .predicted(Map.of("x", 1))
                .observed(Map.of("x", 5))
                .anomaly("x", "high", 0.91)
                .build();
    }

    @Test
    void testAnomalyStartDelivered() throws Exception {
        MailHook hook = mailHook("{ host: '127.0.0.1', port: " + server.getPort() + " }");

        hook.onAnomalyStart(startEvent());

        assertEquals(1, server.getMessages().size());
        MimeMessage mime = server.getMessages().get(0).toMimeMessage();
        assertEquals("[ALERT] anomaly detected! (model=cpu, score=0.91)", mime.getSubject());

        String content = mime.getContent().toString();
        assertTrue(content.contains("date=2024-03-07 09:11:12+00:00"), content);
        assertTrue(content.contains("feature 'x' is too high (score = 0.9)"), content);
    }

    @Test
    void testAnomalyEndDelivered() throws Exception {
        MailHook hook = mailHook("{ host: '127.0.0.1', port: " + server.getPort() + ", user: 'alerts', password: 'secret' }");
        server.setCredentials("alerts", "secret");

        hook.onAnomalyEnd(AnomalyEvent.end("cpu", DATE, 0.12).build());

        assertEquals(1, server.getAuthAttempts().size());
        assertEquals(1, server.getMessages().size());
        assertEquals("[ALERT] anomaly end (model=cpu, score=0.12)", server.getMessages().get(0).toMimeMessage().getSubject());
    }

    @Test
    void testRejectedCredentialsDoNotPropagate() throws ConfigException {
        MailHook hook = mailHook("{ host: '127.0.0.1', port: " + server.getPort() + ", user: 'alerts' }");
        server.setCredentials("alerts", "secret");

        assertDoesNotThrow(() -> hook.onAnomalyStart(startEvent()));
        assertArrayEquals(new String[]{"alerts", ""}, server.getAuthAttempts().get(0));
        assertTrue(server.getMessages().isEmpty());

        DeliveryResult result = hook.sendMail(EventKind.ANOMALY_START, "cpu", hook.startParameters(startEvent()));
        assertEquals(DeliveryFailure.AUTHENTICATION, result.getFailure());
    }
}
