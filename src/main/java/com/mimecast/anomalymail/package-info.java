/**
 * Anomaly Mailer, email notifications for anomaly detection.
 *
 * <p>An anomaly detection engine calls a hook when an anomaly starts and when it ends.
 * <br>The mail hook renders a message from templates and sends it to one recipient over SMTP.
 * <br>A failing notification is logged and never interrupts detection.
 *
 * <p>Flow of a hook call:
 * <ol>
 *   <li>{@link com.mimecast.anomalymail.hook.MailHook} gathers the event parameters.</li>
 *   <li>{@link com.mimecast.anomalymail.template.TemplateStore} resolves the templates of the event kind.</li>
 *   <li>{@link com.mimecast.anomalymail.render.MessageRenderer} expands them into subject and body.</li>
 *   <li>{@link com.mimecast.anomalymail.mail.MailSender} delivers the message.</li>
 * </ol>
 *
 * <h2>Usage:</h2>
 * <pre>
 *      Config.initPlugin("cfg/mail.json5");
 *      MailHook hook = MailHook.fromConfig("oncall", ConfigLoader.read("cfg/hook.json5"));
 *
 *      hook.onAnomalyStart(AnomalyEvent.start("cpu", Instant.now(), 0.91)
 *              .predicted(predicted)
 *              .observed(observed)
 *              .anomaly("usage", "high", 0.91)
 *              .build());
 * </pre>
 */
package com.mimecast.anomalymail;
