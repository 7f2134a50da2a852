/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins.transform;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.PipelinePayload;
import com.intuitivedesigns.tablekernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.tablekernel.table.NamedTables;
import com.intuitivedesigns.tablekernel.table.SchemaException;
import com.intuitivedesigns.tablekernel.table.Table;
import com.intuitivedesigns.tablekernel.table.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RollupReportTransformerTest {

    @Test
    void marketplaceRentalsBySegment() throws Exception {
        try (MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime()) {
            RollupReportTransformer t = new RollupReportTransformer(
                    ReportSpec.fromConfig(ReportFixtures.marketplaceConfig()), metrics);

            PipelinePayload<NamedTables> in = new PipelinePayload<>("run-1", ReportFixtures.marketplaceInputs(),
                    Map.of("source.primary", "raw_data.csv"));
            PipelinePayload<Table> out = t.transform(in);

            assertEquals(ReportFixtures.marketplaceReport(), out.data());
            assertEquals("run-1", out.id());
            assertEquals("raw_data.csv", out.metadata().get("source.primary"));
            assertEquals("6", out.metadata().get("report.rows"));

            for (String step : new String[] {"normalize", "coerce", "join", "filter", "select", "group",
                    "classify", "pivot", "rollup"}) {
                assertEquals(1L, metrics.timerCount(RollupReportTransformer.METRIC_STEP_PREFIX + step), step);
            }
        }
    }

    @Test
    void hospitalBillingByAgeRange() throws Exception {
        RollupReportTransformer t = new RollupReportTransformer(
                ReportSpec.fromConfig(PipelineConfig.of(ReportFixtures.hospitalSettings())), null);

        Table report = t.build(ReportFixtures.hospitalInputs());

        assertEquals(ReportFixtures.hospitalReport(), report);
        assertEquals("Grand Total", report.value(report.rowCount() - 1, "Province"));
    }

    @Test
    void filterThatRemovesEveryRowLeavesOnlyAZeroGrandTotal() throws Exception {
        Map<String, String> settings = ReportFixtures.marketplaceSettings();
        settings.put("report.filter.value", "100000");
        RollupReportTransformer t = new RollupReportTransformer(
                ReportSpec.fromConfig(PipelineConfig.of(settings)), null);

        Table report = t.build(ReportFixtures.marketplaceInputs());

        Table expected = Table.builder("MARKET_PLACE", "Category", "Seg 1-3", "Seg 4-6", "Grand_Total")
                .addRow("Grand Total", "Total", 0L, 0L, 0L)
                .build();
        assertEquals(expected, report);
    }

    @Test
    void missingReferenceTableFailsTheJoin() {
        RollupReportTransformer t = new RollupReportTransformer(
                ReportSpec.fromConfig(ReportFixtures.marketplaceConfig()), null);
        NamedTables onlyPrimary = NamedTables.of("primary", ReportFixtures.marketplaceInputs().require("primary"));

        assertThrows(ValidationException.class, () -> t.build(onlyPrimary));
    }

    @Test
    void unknownColumnInConfigurationIsASchemaError() {
        Map<String, String> settings = ReportFixtures.marketplaceSettings();
        settings.put("report.select.columns", "MARKET_PLACE,Region");
        RollupReportTransformer t = new RollupReportTransformer(
                ReportSpec.fromConfig(PipelineConfig.of(settings)), null);

        SchemaException e = assertThrows(SchemaException.class, () -> t.build(ReportFixtures.marketplaceInputs()));
        assertEquals("Region", e.getColumn());
    }
}
