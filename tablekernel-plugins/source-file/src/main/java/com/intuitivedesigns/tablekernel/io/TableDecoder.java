/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.io;

import com.intuitivedesigns.tablekernel.table.Table;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns one file into a {@link Table}. The first row (or the file schema) names the columns.
 */
public interface TableDecoder {

    Table decode(Path file) throws IOException;
}
