/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.UnsupportedFormatException;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * File formats a table can be read from or written to, keyed by file extension.
 */
public enum TableFormat {
    CSV(Set.of("csv")),
    EXCEL(Set.of("xlsx", "xls")),
    PARQUET(Set.of("parquet"));

    private final Set<String> extensions;

    TableFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * @param extension with or without the leading dot, any case
     * @throws UnsupportedFormatException for anything not listed above
     */
    public static TableFormat forExtension(String extension) {
        final String ext = normalizeExtension(extension);
        for (TableFormat f : values()) {
            if (f.extensions.contains(ext)) return f;
        }
        throw new UnsupportedFormatException(ext.isEmpty() ? "<none>" : "." + ext);
    }

    public static TableFormat forPath(Path path) {
        return forExtension(extensionOf(path));
    }

    /**
     * Lower-cased extension without the dot, empty when the name has none.
     */
    public static String extensionOf(Path path) {
        final String name = path.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return (dot < 0) ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String normalizeExtension(String extension) {
        if (extension == null) return "";
        final String t = extension.trim().toLowerCase(Locale.ROOT);
        return t.startsWith(".") ? t.substring(1) : t;
    }
}
