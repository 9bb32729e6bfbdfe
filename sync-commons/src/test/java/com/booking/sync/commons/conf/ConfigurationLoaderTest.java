package com.booking.sync.commons.conf;

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class ConfigurationLoaderTest {

    @Test
    public void testYamlIsFlattenedToDottedKeys() throws IOException {
        String yaml = "webserver:\n"
                + "  port: 8080\n"
                + "  relay:\n"
                + "    path: /sync\n"
                + "metrics:\n"
                + "  type: JMX\n";

        Map<String, Object> configuration = new ConfigurationLoader()
                .withYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)))
                .load();

        assertEquals(8080, configuration.get("webserver.port"));
        assertEquals("/sync", configuration.get("webserver.relay.path"));
        assertEquals("JMX", configuration.get("metrics.type"));
    }

    @Test
    public void testKeyValuesOverrideYaml() throws IOException {
        String yaml = "webserver:\n  port: 8080\n";

        Map<String, Object> configuration = new ConfigurationLoader()
                .withYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)))
                .withKeyValues("webserver.port=9090", "broken", "=nokey", "novalue=")
                .load();

        assertEquals("9090", configuration.get("webserver.port"));
        assertFalse(configuration.containsKey("broken"));
        assertFalse(configuration.containsKey("novalue"));
        assertEquals(1, configuration.size());
    }
}
