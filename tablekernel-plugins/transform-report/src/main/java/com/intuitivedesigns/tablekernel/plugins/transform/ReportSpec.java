/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins.transform;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.ops.FilterOperator;
import com.intuitivedesigns.tablekernel.ops.JoinKind;
import com.intuitivedesigns.tablekernel.ops.Range;
import com.intuitivedesigns.tablekernel.ops.Relational;
import com.intuitivedesigns.tablekernel.table.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The parameter set of one rollup report, read from {@code report.*} keys.
 *
 * <p>Every step except the pivot and the rollup is optional; a step is enabled by its
 * leading key ({@code report.join.key}, {@code report.filter.column}, ...) and then
 * requires the rest of its keys. Operators and ranges are parsed here so a bad
 * configuration fails when the transformer is created, not halfway through a run.</p>
 */
public record ReportSpec(
        String primaryRole,
        String referenceRole,
        String numericColumn,
        JoinStep join,
        FilterStep filter,
        List<String> selectColumns,
        GroupStep group,
        ClassifyStep classify,
        PivotStep pivot,
        String totalLabel,
        String grandLabel
) {

    public static final String PREFIX = "report.";

    public record JoinStep(List<String> keys, JoinKind kind) {}

    public record FilterStep(String column, FilterOperator operator, Object value) {}

    public record GroupStep(List<String> columns, String counter) {}

    public record ClassifyStep(List<String> keep, String valueColumn, List<Range> ranges,
                               List<String> labels, String defaultLabel, String column) {}

    public record PivotStep(String group1, String group2, String valueColumn, List<Object> values) {}

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d{1,18}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");

    public ReportSpec {
        Objects.requireNonNull(primaryRole, "primaryRole");
        Objects.requireNonNull(pivot, "pivot");
        selectColumns = (selectColumns == null) ? List.of() : List.copyOf(selectColumns);
        if (totalLabel == null) totalLabel = Relational.DEFAULT_TOTAL_LABEL;
        if (grandLabel == null) grandLabel = Relational.DEFAULT_GRAND_LABEL;
    }

    /**
     * @throws ValidationException when a required key is missing or a value does not parse
     * @throws com.intuitivedesigns.tablekernel.table.InvalidOperatorException for an unknown filter operator
     */
    public static ReportSpec fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String primary = config.getString(PREFIX + "input.primary", "primary").trim();
        final String reference = config.getString(PREFIX + "input.reference", "reference").trim();

        JoinStep join = null;
        final List<String> joinKeys = config.getList(PREFIX + "join.key");
        if (!joinKeys.isEmpty()) {
            join = new JoinStep(joinKeys, JoinKind.parse(config.getString(PREFIX + "join.kind", "inner")));
        }

        FilterStep filter = null;
        final String filterColumn = optional(config, "filter.column");
        if (filterColumn != null) {
            filter = new FilterStep(filterColumn,
                    FilterOperator.fromSymbol(required(config, "filter.operator")),
                    literal(required(config, "filter.value")));
        }

        GroupStep group = null;
        final List<String> groupColumns = config.getList(PREFIX + "group.columns");
        if (!groupColumns.isEmpty()) {
            group = new GroupStep(groupColumns, required(config, "group.counter"));
        }

        ClassifyStep classify = null;
        final String classifyValue = optional(config, "classify.value.column");
        if (classifyValue != null) {
            final List<Range> ranges = new ArrayList<>();
            for (String r : requiredList(config, "classify.ranges")) {
                ranges.add(Range.parse(r));
            }
            classify = new ClassifyStep(
                    requiredList(config, "classify.keep"),
                    classifyValue,
                    ranges,
                    requiredList(config, "classify.labels"),
                    required(config, "classify.default"),
                    config.getString(PREFIX + "classify.column", Relational.DEFAULT_CATEGORY_COLUMN).trim());
        }

        final List<Object> pivotValues = new ArrayList<>();
        for (String v : requiredList(config, "pivot.values")) {
            pivotValues.add(literal(v));
        }
        final PivotStep pivot = new PivotStep(
                required(config, "pivot.group1"),
                required(config, "pivot.group2"),
                required(config, "pivot.value.column"),
                pivotValues);

        return new ReportSpec(
                primary,
                reference,
                optional(config, "numeric.column"),
                join,
                filter,
                config.getList(PREFIX + "select.columns"),
                group,
                classify,
                pivot,
                optional(config, "rollup.total.label"),
                optional(config, "rollup.grand.label"));
    }

    /**
     * Config values are text; numeric-looking ones become {@code Long} or {@code Double}
     * so they compare against coerced columns.
     */
    static Object literal(String text) {
        final String t = text.trim();
        if (INTEGER.matcher(t).matches()) return Long.parseLong(t);
        if (DECIMAL.matcher(t).matches()) return Double.parseDouble(t);
        return t;
    }

    private static String optional(PipelineConfig config, String key) {
        final String v = config.getString(PREFIX + key, null);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String required(PipelineConfig config, String key) {
        final String v = optional(config, key);
        if (v == null) {
            throw new ValidationException("Missing config: " + PREFIX + key);
        }
        return v;
    }

    private static List<String> requiredList(PipelineConfig config, String key) {
        final List<String> v = config.getList(PREFIX + key);
        if (v.isEmpty()) {
            throw new ValidationException("Missing config: " + PREFIX + key);
        }
        return v;
    }
}
