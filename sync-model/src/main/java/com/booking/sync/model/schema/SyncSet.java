package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of tables taking part in a sync. Supplied from outside and only read by the engine.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncSet implements Serializable {
    private List<SyncTable> tables;

    public SyncSet() {
        this.tables = new ArrayList<>();
    }

    public SyncSet(List<SyncTable> tables) {
        this.tables = new ArrayList<>(tables);
    }

    /**
     * Builds a set carrying only the table names and filters of the setup. Such a set has tables but no columns.
     */
    public SyncSet(SyncSetup setup) {
        this();

        for (String tableName : setup.getTables()) {
            SyncTable table = SyncTable.parse(tableName);

            setup.getFilters()
                    .stream()
                    .filter(filter -> filter.appliesTo(table))
                    .findFirst()
                    .ifPresent(table::setFilter);

            this.tables.add(table);
        }
    }

    public SyncSet withTable(SyncTable table) {
        this.tables.add(table);
        return this;
    }

    public boolean hasTables() {
        return this.tables != null && !this.tables.isEmpty();
    }

    public boolean hasColumns() {
        return this.hasTables() && this.tables.stream().allMatch(SyncTable::hasColumns);
    }

    public Optional<SyncTable> findTable(String tableName, String schemaName) {
        return this.tables
                .stream()
                .filter(table -> table.hasName(tableName, schemaName))
                .findFirst();
    }

    /**
     * Parent tables of the given table that belong to this set. Relations to tables outside the set are ignored.
     */
    @JsonIgnore
    public List<SyncTable> getParentTables(SyncTable table) {
        List<SyncTable> parents = new ArrayList<>();

        for (SyncRelation relation : table.getRelations()) {
            this.findTable(relation.getParentTableName(), relation.getParentSchemaName())
                    .filter(parent -> parent != table)
                    .ifPresent(parents::add);
        }

        return parents;
    }

    public List<SyncTable> getTables() {
        return this.tables;
    }

    public void setTables(List<SyncTable> tables) {
        this.tables = tables;
    }
}
