package com.booking.sync.core.exception;

import com.booking.sync.model.SyncSide;
import com.booking.sync.model.SyncStage;

import java.sql.SQLException;

/**
 * Error raised by every orchestrator operation. Carries the stage the pipeline was in, the node that failed and,
 * when the storage engine provides them, the data source, catalog and engine error number.
 */
public class SyncException extends Exception {
    private SyncStage stage;
    private SyncSide side;
    private String typeName;
    private String dataSource;
    private String initialCatalog;
    private Integer number;

    public SyncException(Throwable cause, SyncStage stage) {
        super(SyncException.messageOf(cause), cause);

        this.stage = (stage == null) ? SyncStage.NONE : stage;
        this.typeName = cause.getClass().getSimpleName();

        if (SQLException.class.isInstance(cause)) {
            this.number = SQLException.class.cast(cause).getErrorCode();
        }
    }

    /**
     * Rebuilds an error reported by a remote node.
     */
    public SyncException(String message, SyncStage stage, String typeName) {
        super(message);

        this.stage = (stage == null) ? SyncStage.NONE : stage;
        this.typeName = typeName;
    }

    private static String messageOf(Throwable cause) {
        return (cause.getMessage() != null) ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public SyncStage getStage() {
        return this.stage;
    }

    public void setStage(SyncStage stage) {
        this.stage = stage;
    }

    public SyncSide getSide() {
        return this.side;
    }

    public void setSide(SyncSide side) {
        this.side = side;
    }

    public String getTypeName() {
        return this.typeName;
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

    @Override
    public String toString() {
        return String.format(
                "%s: %s [stage: %s, side: %s, type: %s, data source: %s, catalog: %s, number: %s]",
                SyncException.class.getSimpleName(),
                this.getMessage(),
                this.stage,
                this.side,
                this.typeName,
                this.dataSource,
                this.initialCatalog,
                this.number
        );
    }
}
