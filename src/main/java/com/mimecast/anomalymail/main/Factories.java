package com.mimecast.anomalymail.main;

import com.mimecast.anomalymail.mail.MailSender;
import com.mimecast.anomalymail.mail.SmtpMailSender;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Callable;

/**
 * Factories for pluggable components.
 *
 * <p>This is a factories container for extensible components.
 * <p>Set a callable to inject yours.
 */
public class Factories {
    private static final Logger log = LogManager.getLogger(Factories.class);

    /**
     * Mail sender.
     * <p>Delivers rendered alerts.
     */
    private static Callable<MailSender> mailSender;

    /**
     * Private constructor.
     */
    private Factories() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Sets MailSender.
     *
     * @param callable MailSender callable.
     */
    public static void setMailSender(Callable<MailSender> callable) {
        mailSender = callable;
    }

    /**
     * Gets MailSender.
     *
     * @return MailSender instance.
     */
    public static MailSender getMailSender() {
        if (mailSender != null) {
            try {
                return mailSender.call();
            } catch (Exception e) {
                log.error("Error calling mail sender: {}", e.getMessage());
            }
        }

        return new SmtpMailSender();
    }
}
