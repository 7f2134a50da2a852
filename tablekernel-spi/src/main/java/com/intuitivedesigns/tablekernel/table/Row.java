/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of one row of a {@link Table}.
 */
public final class Row {

    private final Table table;
    private final int index;

    Row(Table table, int index) {
        this.table = table;
        this.index = index;
    }

    public int index() {
        return index;
    }

    public Object get(String column) {
        return table.value(index, column);
    }

    public Object get(int column) {
        return table.value(index, column);
    }

    public List<Object> values() {
        return Collections.unmodifiableList(Arrays.asList(table.rowValues(index)));
    }

    public Map<String, Object> asMap() {
        return Table.asMap(table.columns(), table.rowValues(index));
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
