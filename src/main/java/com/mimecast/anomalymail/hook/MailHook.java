package com.mimecast.anomalymail.hook;

import com.mimecast.anomalymail.config.ConfigException;
import com.mimecast.anomalymail.config.ConfigValidator;
import com.mimecast.anomalymail.config.HookConfig;
import com.mimecast.anomalymail.config.MailPlugin;
import com.mimecast.anomalymail.config.TransportConfig;
import com.mimecast.anomalymail.mail.DeliveryFailure;
import com.mimecast.anomalymail.mail.DeliveryResult;
import com.mimecast.anomalymail.mail.MailSender;
import com.mimecast.anomalymail.main.Config;
import com.mimecast.anomalymail.main.Factories;
import com.mimecast.anomalymail.render.MessageRenderer;
import com.mimecast.anomalymail.render.RenderException;
import com.mimecast.anomalymail.render.RenderedMessage;
import com.mimecast.anomalymail.render.TemplateValue;
import com.mimecast.anomalymail.template.EventKind;
import com.mimecast.anomalymail.template.TemplatePair;
import com.mimecast.anomalymail.template.TemplateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Mail notification hook.
 *
 * <p>Sends an email to the configured recipient when an anomaly starts or ends.
 * <br>Each call resolves the event templates, renders them and hands the message to the {@link MailSender}.
 *
 * <p>Failures never leave the hook:
 * <ul>
 *   <li>No SMTP transport configured: logged as a warning, nothing is sent.</li>
 *   <li>Template or rendering error: logged as an error with model and hook name.</li>
 *   <li>Delivery error: logged as an error with model, hook name and cause.</li>
 * </ul>
 *
 * <p>Template parameters:
 * <ul>
 *   <li><b>model</b>: model name.</li>
 *   <li><b>date</b>: event time in the hook zone, like <i>2024-03-07 10:11:12+01:00</i>.</li>
 *   <li><b>score</b>: anomaly score.</li>
 *   <li><b>predicted</b>, <b>observed</b>: JSON values, anomaly start only.</li>
 *   <li><b>reason</b>: one line per anomalous feature, anomaly start only.</li>
 * </ul>
 * Extra event parameters are added as they are.
 */
public class MailHook implements AnomalyHook {
    private static final Logger log = LogManager.getLogger(MailHook.class);

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ssxxx");
    private static final DateTimeFormatter DATE_MICROS_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSSxxx");

    private final String name;
    private final HookConfig config;
    private final TemplateStore templates;
    private final MessageRenderer renderer = new MessageRenderer();
    private final MailSender sender;
    private final Supplier<MailPlugin> plugin;
    private final ZoneId zone;

    /**
     * Constructs a new MailHook instance.
     * <p>Uses the process-wide plugin, the factory mail sender and the system time zone.
     *
     * @param name   Hook name.
     * @param config HookConfig instance.
     */
    public MailHook(String name, HookConfig config) {
        this(name, config, Factories.getMailSender(), Config::getPlugin, ZoneId.systemDefault());
    }

    /**
     * Constructs a new MailHook instance.
     *
     * @param name   Hook name.
     * @param config HookConfig instance.
     * @param sender MailSender instance.
     * @param plugin MailPlugin supplier, read on every call.
     * @param zone   Time zone for the date parameter.
     */
    public MailHook(String name, HookConfig config, MailSender sender, Supplier<MailPlugin> plugin, ZoneId zone) {
        this.name = Objects.requireNonNull(name, "name");
        this.config = Objects.requireNonNull(config, "config");
        this.templates = new TemplateStore(config.getTemplates());
        this.sender = Objects.requireNonNull(sender, "sender");
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * Constructs hook from raw configuration.
     *
     * @param name Hook name.
     * @param raw  Hook configuration map.
     * @return MailHook instance.
     * @throws ConfigException Invalid configuration.
     */
    public static MailHook fromConfig(String name, Map<String, ?> raw) throws ConfigException {
        return new MailHook(name, ConfigValidator.validateHook(raw));
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Gets hook configuration.
     *
     * @return HookConfig instance.
     */
    public HookConfig getConfig() {
        return config;
    }

    @Override
    public void onAnomalyStart(AnomalyEvent event) {
        try {
            sendMail(EventKind.ANOMALY_START, event.getModel(), startParameters(event));
        } catch (RuntimeException e) {
            log.error("cannot execute {}.{} hook: {}", event != null ? event.getModel() : null, name, e.getMessage(), e);
        }
    }

    @Override
    public void onAnomalyEnd(AnomalyEvent event) {
        try {
            sendMail(EventKind.ANOMALY_END, event.getModel(), endParameters(event));
        } catch (RuntimeException e) {
            log.error("cannot execute {}.{} hook: {}", event != null ? event.getModel() : null, name, e.getMessage(), e);
        }
    }

    /**
     * Builds anomaly start parameters.
     *
     * @param event AnomalyEvent instance.
     * @return Parameters map.
     */
    Map<String, TemplateValue> startParameters(AnomalyEvent event) {
        Map<String, TemplateValue> parameters = commonParameters(event);
        parameters.put("predicted", TemplateValue.json(event.getPredicted().orElse(null)));
        parameters.put("observed", TemplateValue.json(event.getObserved().orElse(null)));
        parameters.put("reason", TemplateValue.text(describe(event.getAnomalies())));
        parameters.putAll(event.getParameters());
        return parameters;
    }

    /**
     * Builds anomaly end parameters.
     *
     * @param event AnomalyEvent instance.
     * @return Parameters map.
     */
    Map<String, TemplateValue> endParameters(AnomalyEvent event) {
        Map<String, TemplateValue> parameters = commonParameters(event);
        parameters.putAll(event.getParameters());
        return parameters;
    }

    private Map<String, TemplateValue> commonParameters(AnomalyEvent event) {
        Map<String, TemplateValue> parameters = new LinkedHashMap<>();
        parameters.put("model", TemplateValue.text(event.getModel()));
        parameters.put("date", TemplateValue.text(formatDate(event.getTimestamp())));
        parameters.put("score", TemplateValue.number(event.getScore()));
        return parameters;
    }

    /**
     * Describes feature anomalies, one line per feature in map order.
     *
     * @param anomalies Feature name to FeatureAnomaly map.
     * @return Description string.
     */
    static String describe(Map<String, FeatureAnomaly> anomalies) {
        List<String> lines = new ArrayList<>(anomalies.size());
        anomalies.forEach((feature, anomaly) -> lines.add(String.format("feature '%s' is too %s (score = %s)",
                feature, anomaly.getType(), MessageRenderer.formatFixed(anomaly.getScore(), 1))));
        return String.join("\n", lines);
    }

    /**
     * Formats timestamp in hook zone.
     * <p>Microseconds are only shown when not zero.
     *
     * @param timestamp Instant.
     * @return Date string.
     */
    String formatDate(Instant timestamp) {
        ZonedDateTime date = timestamp.atZone(zone);
        return date.getNano() / 1000 != 0 ? DATE_MICROS_FORMAT.format(date) : DATE_FORMAT.format(date);
    }

    /**
     * Resolves, renders and sends message.
     *
     * @param kind       EventKind.
     * @param model      Model name.
     * @param parameters Template parameters.
     * @return DeliveryResult instance.
     */
    DeliveryResult sendMail(EventKind kind, String model, Map<String, TemplateValue> parameters) {
        TransportConfig transport = plugin.get().getTransport().orElse(null);
        if (transport == null) {
            log.warn("mail plug-in is not configured, skipping {}.{} hook", model, name);
            return DeliveryResult.failed(DeliveryFailure.UNCONFIGURED, "mail plug-in is not configured", null);
        }

        RenderedMessage message;
        try {
            TemplatePair pair = templates.resolve(kind);
            message = renderer.render(pair, parameters);
        } catch (ConfigException | RenderException e) {
            log.error("cannot execute {}.{} hook: {}", model, name, e.getMessage());
            return DeliveryResult.failed(DeliveryFailure.MESSAGE, e.getMessage(), e);
        }

        DeliveryResult result = sender.send(message, config.getFrom(), config.getTo(), transport);
        if (result.isSuccess()) {
            log.info("{}.{} hook sent {} alert to {}", model, name, kind.getKey(), config.getTo().getAddress());
        } else {
            log.error("cannot execute {}.{} hook: {} {}", model, name, result.getFailure(), result.getMessage());
        }

        return result;
    }
}
