/**
 * Mail delivery.
 *
 * <p>The default sender uses Jakarta Mail over SMTP or SMTPS.
 * <br>A different sender can be injected via {@link com.mimecast.anomalymail.main.Factories}.
 */
package com.mimecast.anomalymail.mail;
