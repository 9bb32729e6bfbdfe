package com.booking.sync.core.orchestrator;

import java.util.Map;

public class SyncOptions {

    public interface Configuration {
        String SCOPE_INFO_TABLE_NAME = "sync.scope.info.table";
        String BATCH_SIZE = "sync.batch.size";
    }

    public static final String DEFAULT_SCOPE_NAME = "DefaultScope";
    public static final String DEFAULT_SCOPE_INFO_TABLE_NAME = "scope_info";
    public static final int DEFAULT_BATCH_SIZE = 500;

    private String scopeInfoTableName;
    private int batchSize;

    public SyncOptions() {
        this.scopeInfoTableName = SyncOptions.DEFAULT_SCOPE_INFO_TABLE_NAME;
        this.batchSize = SyncOptions.DEFAULT_BATCH_SIZE;
    }

    public static SyncOptions build(Map<String, Object> configuration) {
        SyncOptions options = new SyncOptions();

        options.setScopeInfoTableName(configuration.getOrDefault(Configuration.SCOPE_INFO_TABLE_NAME, SyncOptions.DEFAULT_SCOPE_INFO_TABLE_NAME).toString());
        options.setBatchSize(Integer.parseInt(configuration.getOrDefault(Configuration.BATCH_SIZE, SyncOptions.DEFAULT_BATCH_SIZE).toString()));

        return options;
    }

    public String getScopeInfoTableName() {
        return this.scopeInfoTableName;
    }

    public void setScopeInfoTableName(String scopeInfoTableName) {
        this.scopeInfoTableName = scopeInfoTableName;
    }

    public int getBatchSize() {
        return this.batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
