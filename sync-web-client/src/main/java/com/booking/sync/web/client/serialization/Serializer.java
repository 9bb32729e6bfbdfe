package com.booking.sync.web.client.serialization;

import java.io.IOException;

public interface Serializer<T> {

    byte[] serialize(T value) throws IOException;

    T deserialize(byte[] bytes) throws IOException;
}
