package com.mimecast.anomalymail.config;

import com.mimecast.anomalymail.template.EventKind;
import com.mimecast.anomalymail.template.TemplateSet;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    void testReadPlugin() throws ConfigException {
        Map<String, Object> map = ConfigLoader.read("src/test/resources/cfg/mail.json5");

        TransportConfig config = ConfigValidator.validatePlugin(map);
        assertEquals("smtp.example.com", config.getHost());
        assertEquals(465, config.getPort());
        assertTrue(config.isTls());
        assertEquals("alerts", config.getUser().orElse(null));
        assertEquals("secret", config.getPassword());
    }

    @Test
    void testReadHook() throws ConfigException {
        HookConfig config = ConfigValidator.validateHook(ConfigLoader.read("src/test/resources/cfg/hook.json5"));

        assertEquals("Monitoring", config.getFrom().getName());
        assertEquals("oncall@example.com", config.getTo().getAddress());
        assertEquals("[ALERT] {model} is back to normal", config.getTemplates().get(EventKind.ANOMALY_END).getSubject());
        assertEquals(TemplateSet.DEFAULT_ANOMALY_END.getContent(), config.getTemplates().get(EventKind.ANOMALY_END).getContent());
        assertEquals(TemplateSet.DEFAULT_ANOMALY_START, config.getTemplates().get(EventKind.ANOMALY_START));
    }

    @Test
    void testIntegralNumbersAreLong() throws ConfigException {
        Map<String, Object> map = ConfigLoader.parse("inline", "{ port: 25, ratio: 0.5 }");

        assertEquals(25L, map.get("port"));
        assertEquals(0.5, map.get("ratio"));
    }

    @Test
    void testFractionalPortRejected() throws ConfigException {
        Map<String, Object> map = ConfigLoader.parse("inline", "{ smtp: { host: 'localhost', port: 25.5 } }");

        ConfigException e = assertThrows(ConfigException.class, () -> ConfigValidator.validatePlugin(map));
        assertEquals("smtp.port", e.getField());
    }

    @Test
    void testEmptyContent() throws ConfigException {
        assertTrue(ConfigLoader.parse("inline", "").isEmpty());
    }

    @Test
    void testInvalidContent() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.parse("inline", "[1, 2]"));
        assertEquals("inline", e.getField());
    }

    @Test
    void testMissingFile() {
        ConfigException e = assertThrows(ConfigException.class, () -> ConfigLoader.read("src/test/resources/cfg/missing.json5"));
        assertEquals("src/test/resources/cfg/missing.json5", e.getField());
    }
}
