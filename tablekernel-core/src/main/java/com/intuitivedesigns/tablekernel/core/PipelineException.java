/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.tablekernel.core;

/**
 * A pipeline run failed. The cause is the error raised by the failing stage.
 */
public class PipelineException extends RuntimeException {

    private final String stage;

    public PipelineException(String stage, String runId, Throwable cause) {
        super("Pipeline run " + runId + " failed during " + stage + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    /**
     * One of {@code extract}, {@code transform} or {@code load}.
     */
    public String getStage() {
        return stage;
    }
}
