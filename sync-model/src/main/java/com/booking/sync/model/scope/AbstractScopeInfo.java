package com.booking.sync.model.scope;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

/**
 * Common part of the scope records. {@link #isNewScope()} is derived from {@link #getLastSync()} and never stored.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class AbstractScopeInfo implements Serializable {
    private UUID id;
    private String name;
    private Long lastSync;

    protected AbstractScopeInfo() {
    }

    protected AbstractScopeInfo(UUID id, String name) {
        this.id = id;
        this.name = name;
    }

    public UUID getId() {
        return this.id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return this.name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Watermark of the last complete sync, as epoch milliseconds. {@code null} until a first sync completes.
     */
    public Long getLastSync() {
        return this.lastSync;
    }

    public void setLastSync(Long lastSync) {
        this.lastSync = lastSync;
    }

    @JsonProperty(value = "isNewScope", access = JsonProperty.Access.READ_ONLY)
    public boolean isNewScope() {
        return this.lastSync == null;
    }

    @Override
    public boolean equals(Object other) {
        if (other == null || !this.getClass().equals(other.getClass())) {
            return false;
        }

        AbstractScopeInfo scope = AbstractScopeInfo.class.cast(other);

        return Objects.equals(this.id, scope.id)
                && Objects.equals(this.name, scope.name)
                && Objects.equals(this.lastSync, scope.lastSync);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.name, this.lastSync);
    }

    @Override
    public String toString() {
        return String.format("%s: %s (%s), last sync: %s", this.getClass().getSimpleName(), this.name, this.id, this.lastSync);
    }
}
