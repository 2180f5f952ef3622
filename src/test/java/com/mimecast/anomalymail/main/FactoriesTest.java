package com.mimecast.anomalymail.main;

import com.mimecast.anomalymail.mail.MailSender;
import com.mimecast.anomalymail.mail.SmtpMailSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class FactoriesTest {

    @AfterEach
    void tearDown() {
        Factories.setMailSender(null);
    }

    @Test
    void testDefaultMailSender() {
        assertInstanceOf(SmtpMailSender.class, Factories.getMailSender());
    }

    @Test
    void testCustomMailSender() {
        MailSender sender = mock(MailSender.class);
        Factories.setMailSender(() -> sender);

        assertSame(sender, Factories.getMailSender());
    }

    @Test
    void testFailingCallableFallsBack() {
        Factories.setMailSender(() -> {
            throw new IllegalStateException("no sender");
        });

        assertInstanceOf(SmtpMailSender.class, Factories.getMailSender());
    }
}
