package com.booking.sync.model;

public enum SyncSide {
    CLIENT,
    SERVER
}
