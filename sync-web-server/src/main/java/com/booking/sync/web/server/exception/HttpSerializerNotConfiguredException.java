package com.booking.sync.web.server.exception;

import java.util.List;

public class HttpSerializerNotConfiguredException extends Exception {

    public HttpSerializerNotConfiguredException(List<String> configured) {
        super(String.format("Unexpected value for serializer. Available serializers on the server: %s", String.join(", ", configured)));
    }
}
