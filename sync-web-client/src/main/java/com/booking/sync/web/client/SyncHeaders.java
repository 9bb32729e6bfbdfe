package com.booking.sync.web.client;

public interface SyncHeaders {
    String SESSION_ID = "sync-session-id";
    String STEP = "sync-step";
    String SERIALIZATION_FORMAT = "sync-serialization-format";
    String CONVERTER = "sync-converter";
}
