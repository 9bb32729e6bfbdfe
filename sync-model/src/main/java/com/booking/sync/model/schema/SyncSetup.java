package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * What the user asks to synchronize: table names (optionally {@code schema.table}) and their filters.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncSetup implements Serializable {
    private List<String> tables;
    private List<SyncFilter> filters;

    public SyncSetup() {
        this.tables = new ArrayList<>();
        this.filters = new ArrayList<>();
    }

    public SyncSetup(String... tables) {
        this();
        this.tables.addAll(Arrays.asList(tables));
    }

    public SyncSetup withFilter(SyncFilter filter) {
        this.filters.add(filter);
        return this;
    }

    public boolean hasTables() {
        return this.tables != null && !this.tables.isEmpty();
    }

    public List<String> getTables() {
        return this.tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public List<SyncFilter> getFilters() {
        return this.filters;
    }

    public void setFilters(List<SyncFilter> filters) {
        this.filters = filters;
    }
}
