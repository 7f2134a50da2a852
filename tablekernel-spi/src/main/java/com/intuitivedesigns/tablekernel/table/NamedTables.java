/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Input tables keyed by the logical role they fill in a pipeline ("primary", "reference", ...).
 *
 * <p>Transforms look tables up by role instead of relying on the order files were read in.
 * Iteration order is the order the roles were declared.</p>
 */
public final class NamedTables {

    private final Map<String, Table> byRole;

    private NamedTables(Map<String, Table> byRole) {
        this.byRole = Collections.unmodifiableMap(byRole);
    }

    public static NamedTables of(Map<String, Table> tables) {
        Objects.requireNonNull(tables, "tables");
        return new NamedTables(new LinkedHashMap<>(tables));
    }

    public static NamedTables of(String role, Table table) {
        return builder().put(role, table).build();
    }

    public static NamedTables of(String role1, Table table1, String role2, Table table2) {
        return builder().put(role1, table1).put(role2, table2).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ValidationException if no table fills the role
     */
    public Table require(String role) {
        final Table t = byRole.get(role);
        if (t == null) {
            throw new ValidationException("No input table for role '" + role + "'. Available roles: " + byRole.keySet());
        }
        return t;
    }

    public Set<String> roles() {
        return byRole.keySet();
    }

    public int size() {
        return byRole.size();
    }

    public Map<String, Table> asMap() {
        return byRole;
    }

    /**
     * Applies {@code fn} to every table, keeping the roles and their order.
     */
    public NamedTables map(UnaryOperator<Table> fn) {
        final Map<String, Table> out = new LinkedHashMap<>();
        byRole.forEach((role, table) -> out.put(role, fn.apply(table)));
        return new NamedTables(out);
    }

    @Override
    public String toString() {
        return "NamedTables" + byRole;
    }

    public static final class Builder {
        private final Map<String, Table> tables = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String role, Table table) {
            Objects.requireNonNull(role, "role");
            Objects.requireNonNull(table, "table");
            if (tables.putIfAbsent(role, table) != null) {
                throw new ValidationException("Duplicate input role '" + role + "'");
            }
            return this;
        }

        public NamedTables build() {
            return new NamedTables(new LinkedHashMap<>(tables));
        }
    }
}
