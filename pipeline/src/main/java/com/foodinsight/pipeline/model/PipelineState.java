package com.foodinsight.pipeline.model;

public enum PipelineState {
    INITIALIZING,
    RUNNING,
    STOPPED
}
