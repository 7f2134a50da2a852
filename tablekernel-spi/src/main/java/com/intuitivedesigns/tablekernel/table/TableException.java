/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

/**
 * Base exception for every failure raised by table operations.
 *
 * <p>All subclasses are unchecked and are raised synchronously by the call that
 * detects the problem. Nothing in the library retries or recovers locally; the
 * orchestrator aborts the run.</p>
 */
public class TableException extends RuntimeException {

    private final String column;

    public TableException(String message) {
        super(message);
        this.column = null;
    }

    public TableException(String message, Throwable cause) {
        super(message, cause);
        this.column = null;
    }

    public TableException(String column, String message) {
        super(message);
        this.column = column;
    }

    public TableException(String column, String message, Throwable cause) {
        super(message, cause);
        this.column = column;
    }

    /**
     * Returns the column the error refers to, or {@code null} when it is not column specific.
     */
    public String getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        if (column != null && !column.isEmpty()) {
            return "Column '" + column + "': " + super.getMessage();
        }
        return super.getMessage();
    }
}
