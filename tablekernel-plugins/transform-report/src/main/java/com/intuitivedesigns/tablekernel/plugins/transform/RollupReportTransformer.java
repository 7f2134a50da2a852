/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins.transform;

import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.core.Transformer;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.metrics.MetricsUtil;
import com.intuitivedesigns.tablekernel.ops.Relational;
import com.intuitivedesigns.tablekernel.table.NamedTables;
import com.intuitivedesigns.tablekernel.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Turns the extracted input tables into one rollup report.
 *
 * <p>Steps run in a fixed order: normalize, coerce, join, filter, select, group,
 * classify, pivot, then rollup with canonical ordering. Each step is timed as
 * {@code report.step.<name>}; the first failure propagates and aborts the run.</p>
 */
public final class RollupReportTransformer implements Transformer<NamedTables, Table> {

    private static final Logger log = LoggerFactory.getLogger(RollupReportTransformer.class);

    public static final String METRIC_STEP_PREFIX = "report.step.";
    public static final String METRIC_ROWS_OUT = "report.rows.out";

    private final ReportSpec spec;
    private final MetricsRuntime metrics;

    public RollupReportTransformer(ReportSpec spec, MetricsRuntime metrics) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    @Override
    public PipelinePayload<Table> transform(PipelinePayload<NamedTables> input) throws Exception {
        Objects.requireNonNull(input, "input");
        final Table report = build(input.data());
        metrics.counter(METRIC_ROWS_OUT, report.rowCount());
        return input.withData(report)
                .withHeader("report.rows", Integer.toString(report.rowCount()));
    }

    /**
     * Runs every configured step against {@code inputs}.
     */
    public Table build(NamedTables inputs) throws Exception {
        Objects.requireNonNull(inputs, "inputs");

        final NamedTables normalized = step("normalize", () -> inputs.map(Relational::normalizeColumns));
        Table df = normalized.require(spec.primaryRole());

        if (spec.numericColumn() != null) {
            final Table in = df;
            df = step("coerce", () -> Relational.coerceNumeric(in, spec.numericColumn()));
        }

        if (spec.join() != null) {
            final Table left = df;
            final Table right = normalized.require(spec.referenceRole());
            final ReportSpec.JoinStep j = spec.join();
            df = step("join", () -> Relational.join(left, right, j.keys(), j.kind()));
        }

        if (spec.filter() != null) {
            final Table in = df;
            final ReportSpec.FilterStep f = spec.filter();
            df = step("filter", () -> Relational.filter(in, f.column(), f.operator(), f.value()));
        }

        if (!spec.selectColumns().isEmpty()) {
            final Table in = df;
            df = step("select", () -> Relational.select(in, spec.selectColumns()));
        }

        if (spec.group() != null) {
            final Table in = df;
            final ReportSpec.GroupStep g = spec.group();
            df = step("group", () -> Relational.groupCount(in, g.columns(), g.counter()));
        }

        if (spec.classify() != null) {
            final Table in = df;
            final ReportSpec.ClassifyStep c = spec.classify();
            df = step("classify", () -> Relational.classify(in, c.keep(), c.valueColumn(), c.ranges(),
                    c.labels(), c.defaultLabel(), c.column()));
        }

        final Table classified = df;
        final ReportSpec.PivotStep p = spec.pivot();
        final Table pivot = step("pivot", () -> Relational.pivotCount(classified, p.group1(), p.group2(),
                p.valueColumn(), p.values()));

        return step("rollup", () -> Relational.rollupReport(pivot, p.group1(), p.group2(),
                spec.totalLabel(), spec.grandLabel()));
    }

    private <T> T step(String name, Callable<T> body) throws Exception {
        final T result = MetricsUtil.timed(metrics, METRIC_STEP_PREFIX + name, body);
        if (result instanceof Table t) {
            log.info("Step {}: {} rows, columns={}", name, t.rowCount(), t.columns());
        } else {
            log.debug("Step {} done", name);
        }
        return result;
    }

    ReportSpec spec() {
        return spec;
    }
}
