/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

/**
 * Parameters have the wrong shape: mismatched parallel lists, empty required lists,
 * incompatible value types or a missing input table.
 */
public class ValidationException extends TableException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String column, String message) {
        super(column, message);
    }

    public ValidationException(String column, String message, Throwable cause) {
        super(column, message, cause);
    }
}
