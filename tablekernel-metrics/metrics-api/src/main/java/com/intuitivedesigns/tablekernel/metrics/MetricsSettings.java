/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.metrics;

import com.intuitivedesigns.tablekernel.config.PipelineConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable configuration container for Metrics Runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_STEP_SECONDS = "metrics.step.seconds";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";

    // ---- Defaults ----
    public static final String PROVIDER_NONE = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 60;

    // ---- Public Immutable Fields ----
    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;

    private MetricsSettings(String providerId, Map<String, String> commonTags, Duration step) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
    }

    public static MetricsSettings from(PipelineConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, PROVIDER_NONE));

        final int stepSec = clampInt(config.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600);

        // --- Tag Parsing ---
        final Map<String, String> tags = new TreeMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            if (tagKey.isEmpty()) continue;

            final String valStr = String.valueOf(entry.getValue()).trim();
            if (valStr.isEmpty()) continue;

            tags.put(tagKey, valStr);
        }

        return new MetricsSettings(
                provider == null ? PROVIDER_NONE : provider,
                Collections.unmodifiableMap(tags),
                Duration.ofSeconds(stepSec)
        );
    }

    public boolean disabled() {
        return PROVIDER_NONE.equals(providerId);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                '}';
    }

    // --- Helpers ---

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
