package com.booking.sync.web.client.serialization;

/**
 * Named wire format. Both nodes must register a factory under the same key.
 */
public interface SerializerFactory {

    String getKey();

    <T> Serializer<T> getSerializer(Class<T> type);
}
