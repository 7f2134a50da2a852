/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a {@link Table} to one file, replacing any existing content.
 */
public interface TableEncoder {

    void encode(Table table, Path file) throws IOException;
}
