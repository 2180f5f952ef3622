/**
 * Handles the configuration of the mail plugin and its hooks.
 *
 * <p>Raw maps, usually read from JSON5 files by {@link com.mimecast.anomalymail.config.ConfigLoader},
 * <br>are validated by {@link com.mimecast.anomalymail.config.ConfigValidator} into immutable values.
 *
 * <p>Two configuration blocks exist:
 * <ul>
 *   <li><b>plugin</b>: process-wide SMTP transport under the <code>smtp</code> key.</li>
 *   <li><b>hook</b>: sender, recipient and optional template overrides per hook.</li>
 * </ul>
 *
 * <p>Plugin example:
 * <pre>
 * {
 *   smtp: {
 *     host: "smtp.example.com",
 *     port: 465,
 *     tls: true,
 *     user: "alerts",
 *     password: "secret"
 *   }
 * }
 * </pre>
 */
package com.mimecast.anomalymail.config;
