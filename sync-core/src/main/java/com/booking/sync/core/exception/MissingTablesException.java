package com.booking.sync.core.exception;

public class MissingTablesException extends Exception {

    public MissingTablesException() {
        super("Your setup or schema does not contain any table");
    }
}
