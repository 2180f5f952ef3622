package com.mimecast.anomalymail.mail;

import com.mimecast.anomalymail.config.Party;
import com.mimecast.anomalymail.config.TransportConfig;
import com.mimecast.anomalymail.render.RenderedMessage;

/**
 * Mail sender interface.
 *
 * <p>Delivers one rendered message to one recipient per call and releases the connection.
 * <p>Implementations must never throw: every failure is reported as a failed {@link DeliveryResult}.
 *
 * @see SmtpMailSender
 */
public interface MailSender {

    /**
     * Sends message.
     *
     * @param message   RenderedMessage instance.
     * @param from      Sender party.
     * @param to        Recipient party.
     * @param transport TransportConfig instance, null if unconfigured.
     * @return DeliveryResult instance.
     */
    DeliveryResult send(RenderedMessage message, Party from, Party to, TransportConfig transport);
}
