package com.booking.sync.model;

/**
 * Pipeline stages. Every orchestrator operation moves linearly from its starting stage to its terminal stage.
 */
public enum SyncStage {
    NONE,

    PROVISIONING,
    PROVISIONED,

    DEPROVISIONING,
    DEPROVISIONED,

    SCHEMA_READING,
    SCHEMA_READ,

    SCHEMA_APPLYING,
    TABLE_SCHEMA_APPLYING,
    TABLE_SCHEMA_APPLIED,
    SCHEMA_APPLIED,

    METADATA_CLEANING,
    METADATA_CLEANED,

    SCOPE_LOADING,
    SCOPE_LOADED,

    SCOPE_WRITING,
    SCOPE_SAVED,

    CHANGES_APPLYING,
    CHANGES_SELECTED
}
