package com.booking.sync.web.client.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

public class JsonSerializerFactory implements SerializerFactory {
    public static final String KEY = "json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public String getKey() {
        return JsonSerializerFactory.KEY;
    }

    @Override
    public <T> Serializer<T> getSerializer(Class<T> type) {
        return new Serializer<T>() {
            @Override
            public byte[] serialize(T value) throws IOException {
                return JsonSerializerFactory.MAPPER.writeValueAsBytes(value);
            }

            @Override
            public T deserialize(byte[] bytes) throws IOException {
                return JsonSerializerFactory.MAPPER.readValue(bytes, type);
            }
        };
    }
}
