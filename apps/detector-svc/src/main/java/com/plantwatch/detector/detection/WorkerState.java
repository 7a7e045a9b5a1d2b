package com.plantwatch.detector.detection;

public enum WorkerState {
    IDLE,
    POLLING,
    SCORING,
    PERSISTING,
    CHECKPOINTING,
    ERROR
}
