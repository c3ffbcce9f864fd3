package com.distributed26.transcoding.shared.jobs;

public enum WorkerStatus {
    IDLE,
    BUSY,
    OFFLINE
}
