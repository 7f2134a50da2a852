/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Properties-backed pipeline configuration.
 *
 * <p>{@link #get()} resolves the process-wide configuration from {@code -Dtk.config.path},
 * then ENV {@code TK_CONFIG_PATH}, then the classpath resource named by
 * {@code -Dtk.config.resource}. Tests and embedded callers build instances directly with
 * {@link #of(Properties)} or {@link #fromResource(String)}.</p>
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String PROP_CONFIG_PATH = "tk.config.path";
    public static final String ENV_CONFIG_PATH = "TK_CONFIG_PATH";
    public static final String PROP_CONFIG_RESOURCE = "tk.config.resource";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = load();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig of(Properties source) {
        final Properties copy = new Properties();
        copy.putAll(source);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig of(Map<String, String> source) {
        final Properties copy = new Properties();
        copy.putAll(source);
        return new PipelineConfig(copy);
    }

    public static PipelineConfig fromFile(Path path) {
        final Properties p = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new PipelineConfig(p);
    }

    public static PipelineConfig fromResource(String resource) {
        final ClassLoader cl = resolveClassLoader();
        final Properties p = new Properties();
        try (InputStream is = cl.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Config resource not found on classpath: " + resource);
            }
            p.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config resource: " + resource, e);
        }
        log.info("Loaded {} properties from classpath:{}", p.size(), resource);
        return new PipelineConfig(p);
    }

    private static PipelineConfig load() {
        // 1. System property, 2. environment variable
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }
        if (path != null && !path.isBlank()) {
            return fromFile(Path.of(path.trim()));
        }

        // 3. Bundled resource
        final String resource = System.getProperty(PROP_CONFIG_RESOURCE);
        if (resource != null && !resource.isBlank()) {
            return fromResource(resource.trim());
        }

        log.warn("No configuration specified. Usage: -D{}=/path/to/pipeline.properties or -D{}=marketplace.properties",
                PROP_CONFIG_PATH, PROP_CONFIG_RESOURCE);
        return new PipelineConfig(new Properties());
    }

    // --- Typed accessors ---

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    /**
     * Comma separated list, entries trimmed, blanks dropped. Empty when the key is absent.
     */
    public List<String> getList(String key) {
        final String val = props.getProperty(key);
        if (val == null || val.isBlank()) return List.of();
        final List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            final String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineConfig.class.getClassLoader();
    }
}
