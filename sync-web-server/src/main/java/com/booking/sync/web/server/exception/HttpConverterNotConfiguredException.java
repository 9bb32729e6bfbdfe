package com.booking.sync.web.server.exception;

import java.util.List;

public class HttpConverterNotConfiguredException extends Exception {

    public HttpConverterNotConfiguredException(List<String> configured) {
        super(String.format("Unexpected value for converter. Available converters on the server: %s", String.join(", ", configured)));
    }
}
