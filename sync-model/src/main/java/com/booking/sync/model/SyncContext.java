package com.booking.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Correlates every step of one orchestrator call. Never persisted.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncContext implements Serializable {
    private UUID sessionId;
    private String scopeName;
    private SyncStage syncStage;
    private long startTime;

    public SyncContext() {
    }

    public SyncContext(UUID sessionId, String scopeName) {
        this.sessionId = Objects.requireNonNull(sessionId);
        this.scopeName = scopeName;
        this.syncStage = SyncStage.NONE;
        this.startTime = System.currentTimeMillis();
    }

    public UUID getSessionId() {
        return this.sessionId;
    }

    public void setSessionId(UUID sessionId) {
        this.sessionId = sessionId;
    }

    public String getScopeName() {
        return this.scopeName;
    }

    public void setScopeName(String scopeName) {
        this.scopeName = scopeName;
    }

    public SyncStage getSyncStage() {
        return this.syncStage;
    }

    public void setSyncStage(SyncStage syncStage) {
        this.syncStage = syncStage;
    }

    public long getStartTime() {
        return this.startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    @Override
    public String toString() {
        return String.format("context: %s, scope: %s, stage: %s", this.sessionId, this.scopeName, this.syncStage);
    }
}
