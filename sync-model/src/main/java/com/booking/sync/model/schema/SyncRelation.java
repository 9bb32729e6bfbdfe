package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Foreign key from the owning (child) table to its parent table.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncRelation implements Serializable {
    private String name;
    private String parentTableName;
    private String parentSchemaName;
    private List<String> columns;
    private List<String> parentColumns;

    public SyncRelation() {
        this.columns = new ArrayList<>();
        this.parentColumns = new ArrayList<>();
    }

    public SyncRelation(String name, String parentTableName, String parentSchemaName) {
        this();
        this.name = name;
        this.parentTableName = parentTableName;
        this.parentSchemaName = parentSchemaName;
    }

    public SyncRelation(String name, String parentTableName) {
        this(name, parentTableName, null);
    }

    public SyncRelation withColumns(String column, String parentColumn) {
        this.columns.add(column);
        this.parentColumns.add(parentColumn);
        return this;
    }

    public String getName() {
        return this.name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getParentTableName() {
        return this.parentTableName;
    }

    public void setParentTableName(String parentTableName) {
        this.parentTableName = parentTableName;
    }

    public String getParentSchemaName() {
        return this.parentSchemaName;
    }

    public void setParentSchemaName(String parentSchemaName) {
        this.parentSchemaName = parentSchemaName;
    }

    public List<String> getColumns() {
        return this.columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public List<String> getParentColumns() {
        return this.parentColumns;
    }

    public void setParentColumns(List<String> parentColumns) {
        this.parentColumns = parentColumns;
    }
}
