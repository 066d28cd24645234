package com.devflow.core.model;

/**
 * Overall scheduler status derived from the active set and the pending queue.
 */
public enum QueueStatus {
    IDLE,
    RUNNING,
    QUEUED
}
