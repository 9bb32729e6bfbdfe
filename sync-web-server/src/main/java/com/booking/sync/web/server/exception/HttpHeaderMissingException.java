package com.booking.sync.web.server.exception;

public class HttpHeaderMissingException extends Exception {

    public HttpHeaderMissingException(String header) {
        super(String.format("Header %s is missing", header));
    }
}
