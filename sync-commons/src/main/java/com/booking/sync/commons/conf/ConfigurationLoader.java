package com.booking.sync.commons.conf;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the flat configuration map every component is configured with.
 * Nested YAML documents are flattened to dotted keys, so
 * <pre>
 * webserver:
 *   port: 8080
 * </pre>
 * becomes {@code webserver.port=8080}.
 */
public class ConfigurationLoader {
    private static final TypeReference<Map<String, Object>> TYPE_REFERENCE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper mapper;
    private final String delimiter;
    private final Map<String, Object> configuration;

    public ConfigurationLoader() {
        this(".");
    }

    public ConfigurationLoader(String delimiter) {
        this.mapper = new ObjectMapper(new YAMLFactory());
        this.delimiter = delimiter;
        this.configuration = new HashMap<>();
    }

    public ConfigurationLoader withYaml(File file) throws IOException {
        return this.withMap(this.mapper.readValue(file, ConfigurationLoader.TYPE_REFERENCE));
    }

    public ConfigurationLoader withYaml(InputStream inputStream) throws IOException {
        return this.withMap(this.mapper.readValue(inputStream, ConfigurationLoader.TYPE_REFERENCE));
    }

    public ConfigurationLoader withMap(Map<String, Object> map) {
        if (map != null) {
            this.flatten(null, map);
        }
        return this;
    }

    /**
     * Accepts {@code key=value} pairs as given on the command line. Entries without a key or a value are ignored.
     */
    public ConfigurationLoader withKeyValues(String... keyValues) {
        if (keyValues == null) {
            return this;
        }

        for (String keyValue : keyValues) {
            int startIndex = keyValue.indexOf('=');

            if (startIndex > 0 && startIndex + 1 < keyValue.length()) {
                this.configuration.put(keyValue.substring(0, startIndex).trim(), keyValue.substring(startIndex + 1).trim());
            }
        }
        return this;
    }

    public ConfigurationLoader with(String key, Object value) {
        this.configuration.put(key, value);
        return this;
    }

    public Map<String, Object> load() {
        return new HashMap<>(this.configuration);
    }

    @SuppressWarnings("unchecked")
    private void flatten(String path, Map<String, Object> map) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String flattenPath = (path != null) ? String.format("%s%s%s", path, this.delimiter, entry.getKey()) : entry.getKey();

            if (Map.class.isInstance(entry.getValue())) {
                this.flatten(flattenPath, Map.class.cast(entry.getValue()));
            } else {
                this.configuration.put(flattenPath, entry.getValue());
            }
        }
    }
}
