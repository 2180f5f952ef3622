package com.mimecast.anomalymail.mail;

import com.mimecast.anomalymail.config.Party;
import com.mimecast.anomalymail.config.TransportConfig;
import com.mimecast.anomalymail.render.RenderedMessage;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.angus.mail.smtp.SMTPTransport;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Properties;

/**
 * SMTP mail sender using Jakarta Mail.
 *
 * <p>Opens one connection per message, plain <i>smtp</i> or implicit TLS <i>smtps</i>,
 * <br>authenticates when a user is configured, sends and disconnects.
 * <br>A configured user against a server without AUTH fails instead of sending unauthenticated.
 * <p>
 * Notes:
 * - Port 0 leaves the port to Jakarta Mail: 25 for smtp, 465 for smtps.
 * - An empty password is still sent when a user is configured.
 * - No timeouts are set, Jakarta Mail defaults apply.
 * - Set the <i>mailDebug</i> system property to true for the protocol trace.
 */
public class SmtpMailSender implements MailSender {
    private static final Logger log = LogManager.getLogger(SmtpMailSender.class);

    /**
     * Cause chain depth limit when classifying failures.
     */
    private static final int MAX_CAUSE_DEPTH = 16;

    @Override
    public DeliveryResult send(RenderedMessage message, Party from, Party to, TransportConfig transport) {
        if (transport == null) {
            return DeliveryResult.failed(DeliveryFailure.UNCONFIGURED, "SMTP transport is not configured", null);
        }

        String protocol = transport.isTls() ? "smtps" : "smtp";
        Session session = Session.getInstance(buildProperties(protocol, transport));

        MimeMessage mime;
        try {
            mime = buildMessage(session, message, from, to);
        } catch (MessagingException | UnsupportedEncodingException e) {
            log.debug("Unable to compose message for {}: {}", to.getAddress(), e.getMessage());
            return DeliveryResult.failed(DeliveryFailure.MESSAGE, "cannot compose message: " + e.getMessage(), e);
        }

        Transport client = null;
        try {
            client = session.getTransport(protocol);

            String user = transport.hasCredentials() ? transport.getUser().orElse(null) : null;
            client.connect(
                    transport.getHost(),
                    transport.getPort() > 0 ? transport.getPort() : -1,
                    user,
                    user != null ? transport.getPassword() : null
            );

            if (user != null && !supportsAuth(client)) {
                log.debug("SMTP server {} does not advertise AUTH for user '{}'", transport.getHost(), user);
                return DeliveryResult.failed(DeliveryFailure.AUTHENTICATION, "SMTP AUTH extension not supported by server", null);
            }

            log.info("Sending alert to {}", to.getAddress());
            client.sendMessage(mime, mime.getAllRecipients());

            return DeliveryResult.success();

        } catch (AuthenticationFailedException e) {
            log.debug("SMTP authentication failed for user '{}': {}", transport.getUser().orElse(""), e.getMessage());
            return DeliveryResult.failed(DeliveryFailure.AUTHENTICATION, describe(e), e);

        } catch (MessagingException e) {
            DeliveryFailure failure = classify(e);
            log.debug("SMTP {} failure with {}:{}: {}", failure, transport.getHost(), transport.getPort(), describe(e));
            return DeliveryResult.failed(failure, describe(e), e);

        } catch (RuntimeException e) {
            log.debug("Unexpected SMTP client failure: {}", e.getMessage());
            return DeliveryResult.failed(DeliveryFailure.PROTOCOL, describe(e), e);

        } finally {
            close(client);
        }
    }

    /**
     * Builds Jakarta Mail session properties for SMTP/SMTPS.
     *
     * @param protocol  Protocol name.
     * @param transport TransportConfig instance.
     * @return Properties instance.
     */
    Properties buildProperties(String protocol, TransportConfig transport) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", protocol);
        props.put("mail." + protocol + ".host", transport.getHost());
        if (transport.getPort() > 0) {
            props.put("mail." + protocol + ".port", String.valueOf(transport.getPort()));
        }
        props.put("mail." + protocol + ".auth", String.valueOf(transport.hasCredentials()));

        // Debug toggle.
        props.put("mail.debug", System.getProperty("mailDebug", "false"));

        return props;
    }

    /**
     * Builds MIME message.
     *
     * @param session Session instance.
     * @param message RenderedMessage instance.
     * @param from    Sender party.
     * @param to      Recipient party.
     * @return MimeMessage instance.
     * @throws MessagingException           Invalid header.
     * @throws UnsupportedEncodingException Display name cannot be encoded.
     */
    MimeMessage buildMessage(Session session, RenderedMessage message, Party from, Party to) throws MessagingException, UnsupportedEncodingException {
        MimeMessage mime = new MimeMessage(session);
        mime.setFrom(address(from));
        mime.setRecipient(Message.RecipientType.TO, address(to));
        mime.setSubject(message.getSubject(), StandardCharsets.UTF_8.name());
        mime.setText(message.getBody(), StandardCharsets.UTF_8.name());
        mime.setSentDate(new Date());
        mime.saveChanges();

        return mime;
    }

    /**
     * Builds address header value from party.
     *
     * @param party Party instance.
     * @return InternetAddress instance.
     * @throws UnsupportedEncodingException Display name cannot be encoded.
     */
    static InternetAddress address(Party party) throws UnsupportedEncodingException {
        String name = party.getName().isEmpty() ? null : party.getName();
        return new InternetAddress(party.getAddress(), name, StandardCharsets.UTF_8.name());
    }

    /**
     * Classifies messaging failure by cause chain.
     *
     * @param e MessagingException instance.
     * @return DeliveryFailure kind.
     */
    static DeliveryFailure classify(MessagingException e) {
        if (e instanceof AuthenticationFailedException) {
            return DeliveryFailure.AUTHENTICATION;
        }

        boolean io = false;
        Throwable cause = e;
        for (int depth = 0; cause != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (cause instanceof SSLException) {
                return DeliveryFailure.TLS;
            }
            if (cause instanceof IOException) {
                io = true;
            }
            cause = cause.getCause();
        }

        return io ? DeliveryFailure.CONNECTION : DeliveryFailure.PROTOCOL;
    }

    /**
     * Checks if the connected server advertised AUTH in its EHLO reply.
     * <p>Jakarta Mail skips authentication silently when AUTH is not advertised.
     *
     * @param client Connected Transport instance.
     * @return Boolean.
     */
    static boolean supportsAuth(Transport client) {
        if (client instanceof SMTPTransport) {
            SMTPTransport smtp = (SMTPTransport) client;
            return smtp.supportsExtension("AUTH") || smtp.supportsExtension("AUTH=LOGIN");
        }
        return true;
    }

    /**
     * Describes exception including its root cause.
     *
     * @param e Throwable instance.
     * @return Description string.
     */
    private static String describe(Throwable e) {
        Throwable root = e;
        for (int depth = 0; root.getCause() != null && root.getCause() != root && depth < MAX_CAUSE_DEPTH; depth++) {
            root = root.getCause();
        }

        String message = String.valueOf(e.getMessage()).strip();
        if (root != e && root.getMessage() != null) {
            return message + " (" + root.getClass().getSimpleName() + ": " + root.getMessage().strip() + ")";
        }
        return message;
    }

    /**
     * Releases transport connection.
     *
     * @param client Transport instance or null.
     */
    private static void close(Transport client) {
        if (client != null && client.isConnected()) {
            try {
                client.close();
            } catch (MessagingException e) {
                log.warn("Error closing SMTP connection: {}", e.getMessage());
            }
        }
    }
}
