/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.util.List;

/**
 * A referenced column is absent from the input table.
 */
public class SchemaException extends TableException {

    private final List<String> available;

    public SchemaException(String column, List<String> available) {
        super(column, "not found. Available columns: " + available);
        this.available = List.copyOf(available);
    }

    public List<String> getAvailableColumns() {
        return available;
    }
}
