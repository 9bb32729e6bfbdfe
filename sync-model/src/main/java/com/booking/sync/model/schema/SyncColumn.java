package com.booking.sync.model.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncColumn implements Serializable {
    private String name;
    private String dataType;
    private Integer maxLength;
    private boolean allowNull;
    private boolean primaryKey;

    public SyncColumn() {
    }

    public SyncColumn(String name, String dataType) {
        this.name = name;
        this.dataType = dataType;
        this.allowNull = true;
    }

    public static SyncColumn primaryKey(String name, String dataType) {
        SyncColumn column = new SyncColumn(name, dataType);
        column.setAllowNull(false);
        column.setPrimaryKey(true);
        return column;
    }

    public String getName() {
        return this.name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDataType() {
        return this.dataType;
    }

    public void setDataType(String dataType) {
        this.dataType = dataType;
    }

    public Integer getMaxLength() {
        return this.maxLength;
    }

    public void setMaxLength(Integer maxLength) {
        this.maxLength = maxLength;
    }

    public boolean isAllowNull() {
        return this.allowNull;
    }

    public void setAllowNull(boolean allowNull) {
        this.allowNull = allowNull;
    }

    public boolean isPrimaryKey() {
        return this.primaryKey;
    }

    public void setPrimaryKey(boolean primaryKey) {
        this.primaryKey = primaryKey;
    }
}
