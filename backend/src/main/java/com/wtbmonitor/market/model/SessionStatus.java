package com.wtbmonitor.market.model;

public enum SessionStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    ABANDONED
}
