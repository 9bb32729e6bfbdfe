package com.booking.sync.web.client.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Locale;

/**
 * Value of the {@code sync-serialization-format} header: serializer key and batch size.
 */
public class SerializationFormat {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("f")
    private String format;

    @JsonProperty("s")
    private int batchSize;

    public SerializationFormat() {
    }

    public SerializationFormat(String format, int batchSize) {
        this.format = format;
        this.batchSize = batchSize;
    }

    public static SerializationFormat parse(String header) throws IOException {
        return SerializationFormat.MAPPER.readValue(header.toLowerCase(Locale.ROOT), SerializationFormat.class);
    }

    public String toHeader() throws IOException {
        return SerializationFormat.MAPPER.writeValueAsString(this);
    }

    public String getFormat() {
        return this.format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public int getBatchSize() {
        return this.batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
