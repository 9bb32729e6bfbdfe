package com.booking.sync.web.client;

import com.booking.sync.model.SyncStage;

/**
 * Steps of the wire protocol, carried as an integer in the {@code sync-step} header.
 */
public enum HttpStep {
    ENSURE_SCOPES(0, SyncStage.SCOPE_LOADING),
    SEND_CHANGES(1, SyncStage.CHANGES_APPLYING),
    GET_CHANGES(2, SyncStage.CHANGES_APPLYING),
    IN_PROGRESS(3, SyncStage.NONE);

    private final int code;
    private final SyncStage stage;

    HttpStep(int code, SyncStage stage) {
        this.code = code;
        this.stage = stage;
    }

    public int getCode() {
        return this.code;
    }

    public SyncStage getStage() {
        return this.stage;
    }

    public static HttpStep of(int code) {
        for (HttpStep step : HttpStep.values()) {
            if (step.code == code) {
                return step;
            }
        }

        throw new IllegalArgumentException(String.format("Unknown step: %d", code));
    }
}
