/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.table;

/**
 * A filter operator symbol outside the supported closed set.
 */
public class InvalidOperatorException extends TableException {

    private final String symbol;

    public InvalidOperatorException(String symbol, String supported) {
        super("Invalid operator: " + symbol + ". Supported operators are: " + supported);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
