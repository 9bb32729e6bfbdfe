package com.booking.sync.web.client.serialization;

/**
 * Transforms the opaque changes payload before it is written and after it is read, for instance to adapt
 * value encodings between heterogeneous engines.
 */
public interface Converter {

    String getKey();

    byte[] beforeSerialize(byte[] changes);

    byte[] afterDeserialized(byte[] changes);
}
