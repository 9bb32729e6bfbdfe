package com.booking.sync.web.client.message;

import com.booking.sync.core.exception.SyncException;
import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope returned with HTTP 400 by the relay.
 */
@SuppressWarnings("unused")
@JsonIgnoreProperties(ignoreUnknown = true)
public class HttpErrorMessage {

    @JsonProperty("Message")
    private String message;

    @JsonProperty("Stage")
    private SyncStage stage;

    @JsonProperty("TypeName")
    private String typeName;

    @JsonProperty("DataSource")
    private String dataSource;

    @JsonProperty("InitialCatalog")
    private String initialCatalog;

    @JsonProperty("Number")
    private Integer number;

    @JsonProperty("Side")
    private SyncSide side;

    public HttpErrorMessage() {
    }

    public static HttpErrorMessage of(SyncException exception) {
        HttpErrorMessage error = new HttpErrorMessage();

        error.setMessage(exception.getMessage());
        error.setStage(exception.getStage());
        error.setTypeName(exception.getTypeName());
        error.setDataSource(exception.getDataSource());
        error.setInitialCatalog(exception.getInitialCatalog());
        error.setNumber(exception.getNumber());
        error.setSide(exception.getSide());

        return error;
    }

    public SyncException toException() {
        SyncException exception = new SyncException(this.message, this.stage, this.typeName);

        exception.setSide(this.side);
        exception.setDataSource(this.dataSource);
        exception.setInitialCatalog(this.initialCatalog);
        exception.setNumber(this.number);

        return exception;
    }

    public String getMessage() {
        return this.message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public SyncStage getStage() {
        return this.stage;
    }

    public void setStage(SyncStage stage) {
        this.stage = stage;
    }

    public String getTypeName() {
        return this.typeName;
    }

    public void setTypeName(String typeName) {
        this.typeName = typeName;
    }

    public String getDataSource() {
        return this.dataSource;
    }

    public void setDataSource(String dataSource) {
        this.dataSource = dataSource;
    }

    public String getInitialCatalog() {
        return this.initialCatalog;
    }

    public void setInitialCatalog(String initialCatalog) {
        this.initialCatalog = initialCatalog;
    }

    public Integer getNumber() {
        return this.number;
    }

    public void setNumber(Integer number) {
        this.number = number;
    }

    public SyncSide getSide() {
        return this.side;
    }

    public void setSide(SyncSide side) {
        this.side = side;
    }
}
