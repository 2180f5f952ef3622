package com.mimecast.anomalymail.mail;

import com.mimecast.anomalymail.config.ConfigException;
import com.mimecast.anomalymail.config.ConfigValidator;
import com.mimecast.anomalymail.config.HookConfig;
import com.mimecast.anomalymail.config.TransportConfig;
import com.mimecast.anomalymail.render.RenderedMessage;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SmtpMailSender against a mock SMTP server.
 */
class SmtpMailSenderTest {

    private SmtpMockServer server;
    private final SmtpMailSender sender = new SmtpMailSender();
    private HookConfig hook;

    @BeforeEach
    void setUp() throws ConfigException {
        server = new SmtpMockServer();
        assertTrue(server.start(), "Mock server should start");

        Map<String, Object> from = new HashMap<>();
        from.put("name", "Monitoring");
        from.put("address", "monitoring@example.com");
        Map<String, Object> to = new HashMap<>();
        to.put("address", "oncall@example.com");
        Map<String, Object> map = new HashMap<>();
        map.put("from", from);
        map.put("to", to);
        hook = ConfigValidator.validateHook(map);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static TransportConfig transport(int port, boolean tls, String user, String password) throws ConfigException {
        Map<String, Object> map = new HashMap<>();
        map.put("host", "127.0.0.1");
        map.put("port", port);
        map.put("tls", tls);
        if (user != null) map.put("user", user);
        if (password != null) map.put("password", password);
        return ConfigValidator.validateTransport(map);
    }

    @Test
    void testSendWithoutCredentials() throws Exception {
        RenderedMessage message = new RenderedMessage("[ALERT] cpu température", "line one\nscore é 0.91");

        DeliveryResult result = sender.send(message, hook.getFrom(), hook.getTo(), transport(server.getPort(), false, null, null));
        assertTrue(result.isSuccess(), String.valueOf(result));
        assertNull(result.getFailure());
        assertTrue(server.getAuthAttempts().isEmpty(), "No authentication expected without user");

        assertEquals(1, server.getMessages().size());
        SmtpMockServer.Received received = server.getMessages().get(0);
        assertEquals("monitoring@example.com", received.getMail());
        assertEquals(List.of("oncall@example.com"), received.getRcpts());

        MimeMessage mime = received.toMimeMessage();
        assertEquals("[ALERT] cpu température", mime.getSubject());
        InternetAddress from = (InternetAddress) mime.getFrom()[0];
        assertEquals("Monitoring", from.getPersonal());
        assertEquals("monitoring@example.com", from.getAddress());
        assertEquals("oncall@example.com", ((InternetAddress) mime.getAllRecipients()[0]).getAddress());
        assertNotNull(mime.getSentDate());

        String content = mime.getContent().toString();
        assertTrue(content.contains("line one"), content);
        assertTrue(content.contains("score é 0.91"), content);
    }

    @Test
    void testSendWithCredentials() throws Exception {
        server.setCredentials("alerts", "secret");

        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(server.getPort(), false, "alerts", "secret"));
        assertTrue(result.isSuccess(), String.valueOf(result));

        assertEquals(1, server.getAuthAttempts().size());
        assertArrayEquals(new String[]{"alerts", "secret"}, server.getAuthAttempts().get(0));
        assertEquals(1, server.getMessages().size());
    }

    @Test
    void testEmptyPasswordIsStillSent() throws Exception {
        server.setCredentials("alerts", "secret");

        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(server.getPort(), false, "alerts", null));
        assertFalse(result.isSuccess());
        assertEquals(DeliveryFailure.AUTHENTICATION, result.getFailure());
        assertInstanceOf(AuthenticationFailedException.class, result.getCause());

        assertEquals(1, server.getAuthAttempts().size());
        assertArrayEquals(new String[]{"alerts", ""}, server.getAuthAttempts().get(0));
        assertTrue(server.getMessages().isEmpty(), "Nothing should be delivered");
    }

    @Test
    void testCredentialsWithoutServerAuth() throws Exception {
        server.setAuthAdvertised(false);

        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(server.getPort(), false, "alerts", "secret"));
        assertFalse(result.isSuccess());
        assertEquals(DeliveryFailure.AUTHENTICATION, result.getFailure());
        assertTrue(server.getAuthAttempts().isEmpty());
        assertTrue(server.getMessages().isEmpty(), "Nothing should be delivered unauthenticated");
    }

    @Test
    void testNoCredentialsWithoutServerAuth() throws Exception {
        server.setAuthAdvertised(false);

        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(server.getPort(), false, null, null));
        assertTrue(result.isSuccess(), String.valueOf(result));
        assertEquals(1, server.getMessages().size());
    }

    @Test
    void testConnectionRefused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(port, false, null, null));
        assertFalse(result.isSuccess());
        assertEquals(DeliveryFailure.CONNECTION, result.getFailure());
        assertNotNull(result.getMessage());
    }

    @Test
    void testTlsAgainstPlainServer() throws Exception {
        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(),
                transport(server.getPort(), true, null, null));
        assertFalse(result.isSuccess());
        assertEquals(DeliveryFailure.TLS, result.getFailure());
        assertTrue(server.getMessages().isEmpty());
    }

    @Test
    void testNullTransport() {
        DeliveryResult result = sender.send(new RenderedMessage("subject", "body"), hook.getFrom(), hook.getTo(), null);
        assertEquals(DeliveryFailure.UNCONFIGURED, result.getFailure());
        assertEquals(0, server.getConnectionCount());
    }

    @Test
    void testBuildProperties() throws ConfigException {
        Properties plain = sender.buildProperties("smtp", transport(0, false, null, null));
        assertEquals("127.0.0.1", plain.getProperty("mail.smtp.host"));
        assertNull(plain.getProperty("mail.smtp.port"), "Port 0 should leave the protocol default");
        assertEquals("false", plain.getProperty("mail.smtp.auth"));

        Properties secure = sender.buildProperties("smtps", transport(465, true, "alerts", ""));
        assertEquals("smtps", secure.getProperty("mail.transport.protocol"));
        assertEquals("465", secure.getProperty("mail.smtps.port"));
        assertEquals("true", secure.getProperty("mail.smtps.auth"));
    }

    @Test
    void testAddressWithoutName() throws Exception {
        InternetAddress address = SmtpMailSender.address(hook.getTo());
        assertNull(address.getPersonal());
        assertEquals("oncall@example.com", address.toString());

        MimeMessage mime = sender.buildMessage(Session.getInstance(new Properties()),
                new RenderedMessage("s", "b"), hook.getFrom(), hook.getTo());
        assertEquals("Monitoring <monitoring@example.com>", mime.getHeader("From", null));
    }

    @Test
    void testClassify() {
        assertEquals(DeliveryFailure.AUTHENTICATION, SmtpMailSender.classify(new AuthenticationFailedException("535")));
        assertEquals(DeliveryFailure.CONNECTION, SmtpMailSender.classify(new MessagingException("connect", new ConnectException("refused"))));
        assertEquals(DeliveryFailure.CONNECTION, SmtpMailSender.classify(new MessagingException("io", new IOException("reset"))));
        assertEquals(DeliveryFailure.TLS, SmtpMailSender.classify(
                new MessagingException("connect", new IOException("wrapped", new SSLHandshakeException("handshake")))));
        assertEquals(DeliveryFailure.PROTOCOL, SmtpMailSender.classify(new MessagingException("550 rejected")));
    }
}
