package com.booking.sync.web.server.exception;

public class HttpUnsupportedStepException extends Exception {

    public HttpUnsupportedStepException(String step) {
        super(String.format("Step %s is not supported", step));
    }
}
