package com.booking.sync.model.scope;

import com.booking.sync.model.SyncSide;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Backing tables of the scope directory. The client node keeps one, the server node keeps the other two.
 */
public enum ScopeInfoTableType {
    CLIENT,
    SERVER,
    SERVER_HISTORY;

    public static List<ScopeInfoTableType> of(SyncSide side) {
        switch (side) {
            case CLIENT:
                return Collections.singletonList(ScopeInfoTableType.CLIENT);
            case SERVER:
                return Arrays.asList(ScopeInfoTableType.SERVER, ScopeInfoTableType.SERVER_HISTORY);
            default:
                throw new IllegalArgumentException(String.format("Unknown side: %s", side));
        }
    }
}
