/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-name normalization: spaces and forward slashes become underscores.
 * Applying it twice yields the same names as applying it once.
 */
public final class Columns {

    private Columns() {}

    public static String normalize(String name) {
        return name.replace(' ', '_').replace('/', '_');
    }

    /**
     * Returns a table whose column names are normalized. Rows are shared, not copied.
     *
     * @throws ValidationException if two columns collapse onto the same name
     */
    public static Table normalize(Table table) {
        final List<String> names = new ArrayList<>(table.columnCount());
        boolean changed = false;
        for (String c : table.columns()) {
            final String n = normalize(c);
            changed |= !n.equals(c);
            names.add(n);
        }
        if (!changed) return table;

        try {
            return table.renameColumns(names);
        } catch (ValidationException e) {
            throw new ValidationException(e.getColumn(),
                    "columns collide after normalization: " + table.columns(), e);
        }
    }
}
