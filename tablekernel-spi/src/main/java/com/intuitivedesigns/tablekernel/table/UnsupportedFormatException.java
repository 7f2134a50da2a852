/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

/**
 * Raised by ingestion and persistence when a file extension has no codec.
 */
public class UnsupportedFormatException extends TableException {

    private final String extension;

    public UnsupportedFormatException(String extension) {
        super("Unsupported file type: " + extension);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
