package com.booking.sync.model.provision;

public enum SyncProvision {
    TABLE,
    TRACKING_TABLE,
    STORED_PROCEDURES,
    TRIGGERS,
    SCOPE,
    ALL
}
