package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncTable implements Serializable {
    private String tableName;
    private String schemaName;
    private List<SyncColumn> columns;
    private List<SyncRelation> relations;
    private SyncFilter filter;

    public SyncTable() {
        this.columns = new ArrayList<>();
        this.relations = new ArrayList<>();
    }

    public SyncTable(String tableName, String schemaName) {
        this();
        this.tableName = tableName;
        this.schemaName = schemaName;
    }

    public SyncTable(String tableName) {
        this(tableName, null);
    }

    /**
     * Parses {@code schema.table} or {@code table}.
     */
    public static SyncTable parse(String fullName) {
        int index = fullName.lastIndexOf('.');

        if (index > 0 && index < fullName.length() - 1) {
            return new SyncTable(fullName.substring(index + 1), fullName.substring(0, index));
        }
        return new SyncTable(fullName);
    }

    public SyncTable withColumn(SyncColumn column) {
        this.columns.add(column);
        return this;
    }

    public SyncTable withRelation(SyncRelation relation) {
        this.relations.add(relation);
        return this;
    }

    @JsonIgnore
    public String getFullName() {
        return (this.schemaName == null || this.schemaName.isEmpty())
                ? this.tableName
                : String.format("%s.%s", this.schemaName, this.tableName);
    }

    @JsonIgnore
    public boolean hasColumns() {
        return this.columns != null && !this.columns.isEmpty();
    }

    @JsonIgnore
    public List<String> getPrimaryKeys() {
        return this.columns
                .stream()
                .filter(SyncColumn::isPrimaryKey)
                .map(SyncColumn::getName)
                .collect(Collectors.toList());
    }

    public boolean hasName(String tableName, String schemaName) {
        return SyncTable.sameName(this.tableName, this.schemaName, tableName, schemaName);
    }

    static boolean sameName(String tableName, String schemaName, String otherTableName, String otherSchemaName) {
        if (tableName == null || !tableName.equalsIgnoreCase(otherTableName)) {
            return false;
        }

        String schema = (schemaName == null) ? "" : schemaName;
        String otherSchema = (otherSchemaName == null) ? "" : otherSchemaName;

        return schema.equalsIgnoreCase(otherSchema);
    }

    public String getTableName() {
        return this.tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getSchemaName() {
        return this.schemaName;
    }

    public void setSchemaName(String schemaName) {
        this.schemaName = schemaName;
    }

    public List<SyncColumn> getColumns() {
        return this.columns;
    }

    public void setColumns(List<SyncColumn> columns) {
        this.columns = columns;
    }

    public List<SyncRelation> getRelations() {
        return this.relations;
    }

    public void setRelations(List<SyncRelation> relations) {
        this.relations = relations;
    }

    public SyncFilter getFilter() {
        return this.filter;
    }

    public void setFilter(SyncFilter filter) {
        this.filter = filter;
    }

    @Override
    public String toString() {
        return this.getFullName();
    }
}
