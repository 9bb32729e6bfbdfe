package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Row filter applied to a table's tracking artifacts, expressed through named parameters and an optional custom where clause.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncFilter implements Serializable {
    private String tableName;
    private String schemaName;
    private List<String> parameters;
    private String customWhere;

    public SyncFilter() {
        this.parameters = new ArrayList<>();
    }

    public SyncFilter(String tableName, String schemaName) {
        this();
        this.tableName = tableName;
        this.schemaName = schemaName;
    }

    public SyncFilter withParameter(String parameter) {
        this.parameters.add(parameter);
        return this;
    }

    public boolean appliesTo(SyncTable table) {
        return SyncTable.sameName(this.tableName, this.schemaName, table.getTableName(), table.getSchemaName());
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

    public List<String> getParameters() {
        return this.parameters;
    }

    public void setParameters(List<String> parameters) {
        this.parameters = parameters;
    }

    public String getCustomWhere() {
        return this.customWhere;
    }

    public void setCustomWhere(String customWhere) {
        this.customWhere = customWhere;
    }
}
