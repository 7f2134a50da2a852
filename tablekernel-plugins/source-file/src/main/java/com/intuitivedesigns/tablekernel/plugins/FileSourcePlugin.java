/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.plugins;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;
import com.intuitivedesigns.tablekernel.core.SourceConnector;
import com.intuitivedesigns.tablekernel.metrics.MetricsRuntime;
import com.intuitivedesigns.tablekernel.sources.FileSourceConnector;
import com.intuitivedesigns.tablekernel.spi.PluginKind;
import com.intuitivedesigns.tablekernel.spi.SourcePlugin;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class FileSourcePlugin implements SourcePlugin {

    public static final String ID = "FILE";

    // Config Keys
    public static final String CFG_DIR = "source.dir";
    public static final String CFG_INPUTS = "source.inputs";
    public static final String CFG_INPUT_PREFIX = "source.input.";

    // Defaults
    private static final String DEFAULT_DIR = "data/raw";
    private static final List<String> DEFAULT_INPUTS = List.of("primary", "reference");

    @Override
    public String id() {
        return ID;
    }

    @Override
    public PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    public SourceConnector<?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final Path dir = Path.of(config.getString(CFG_DIR, DEFAULT_DIR));

        List<String> roles = config.getList(CFG_INPUTS);
        if (roles.isEmpty()) roles = DEFAULT_INPUTS;

        final Map<String, String> inputs = new LinkedHashMap<>();
        for (String role : roles) {
            final String file = config.getString(CFG_INPUT_PREFIX + role, null);
            if (file == null || file.isBlank()) {
                throw new IllegalArgumentException("Missing config: " + CFG_INPUT_PREFIX + role);
            }
            inputs.put(role, file.trim());
        }

        return new FileSourceConnector(dir, inputs, metrics);
    }
}
