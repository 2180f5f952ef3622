package com.mimecast.anomalymail.main;

import com.mimecast.anomalymail.config.ConfigException;
import com.mimecast.anomalymail.config.ConfigLoader;
import com.mimecast.anomalymail.config.MailPlugin;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Master configuration container.
 *
 * <p>Holds the process-wide mail plugin configuration shared by every mail hook.
 * <p>It is set once at startup and only read afterwards.
 * <p>Until initialized the plugin is unconfigured and hooks skip sending.
 *
 * @see MailPlugin
 */
public class Config {
    private static final Logger log = LogManager.getLogger(Config.class);

    /**
     * Private constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Mail plugin configuration.
     */
    private static volatile MailPlugin plugin = MailPlugin.unconfigured();

    /**
     * Gets mail plugin.
     *
     * @return MailPlugin.
     */
    public static MailPlugin getPlugin() {
        return plugin;
    }

    /**
     * Sets mail plugin.
     *
     * @param mailPlugin MailPlugin instance, null resets to unconfigured.
     */
    public static void setPlugin(MailPlugin mailPlugin) {
        plugin = mailPlugin != null ? mailPlugin : MailPlugin.unconfigured();
    }

    /**
     * Init mail plugin from file.
     *
     * @param path File path.
     * @throws ConfigException Unable to read or validate file.
     */
    public static void initPlugin(String path) throws ConfigException {
        plugin = MailPlugin.fromConfig(ConfigLoader.read(path));
        log.debug("Loaded mail plugin file: {} {}", path, plugin);
    }
}
