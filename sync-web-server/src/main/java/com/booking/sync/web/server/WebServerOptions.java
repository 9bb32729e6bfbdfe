package com.booking.sync.web.server;

import com.booking.sync.commons.util.NamedRegistry;
import com.booking.sync.web.client.serialization.Converter;
import com.booking.sync.web.client.serialization.JsonSerializerFactory;
import com.booking.sync.web.client.serialization.SerializerFactory;

/**
 * Serializers and converters a server accepts, looked up by the lower-cased names sent in the request headers.
 * JSON is always available.
 */
public class WebServerOptions {
    private final NamedRegistry<SerializerFactory> serializers;
    private final NamedRegistry<Converter> converters;

    private ChangesHandler changesHandler;

    public WebServerOptions() {
        this.serializers = new NamedRegistry<SerializerFactory>(SerializerFactory::getKey).register(new JsonSerializerFactory());
        this.converters = new NamedRegistry<>(Converter::getKey);
    }

    public WebServerOptions withSerializer(SerializerFactory serializerFactory) {
        this.serializers.register(serializerFactory);
        return this;
    }

    public WebServerOptions withConverter(Converter converter) {
        this.converters.register(converter);
        return this;
    }

    public WebServerOptions withChangesHandler(ChangesHandler changesHandler) {
        this.changesHandler = changesHandler;
        return this;
    }

    public NamedRegistry<SerializerFactory> getSerializers() {
        return this.serializers;
    }

    public NamedRegistry<Converter> getConverters() {
        return this.converters;
    }

    public ChangesHandler getChangesHandler() {
        return this.changesHandler;
    }
}
