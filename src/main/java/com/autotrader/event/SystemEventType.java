package com.autotrader.event;

public enum SystemEventType {
    ENGINE_STARTED,
    ENGINE_STOPPED,
    ENGINE_PAUSED,
    ENGINE_RESUMED,
    ENGINE_HALTED,
    CYCLE_FAILED,
    RECOVERY_COMPLETED,
    SHUTTING_DOWN
}
