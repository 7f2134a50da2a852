/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

public final class NoopMetricsProvider implements MetricsProvider {

    @Override
    public String id() {
        return "NOOP";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // Only activates for metrics.provider=NOOP; other providers must not be hijacked.
        if (s == null || !matches(s.providerId)) {
            return null;
        }
        return MetricsRuntime.noop();
    }
}
