package com.autotrader.event;

/** What changed about a position. */
public enum PositionEventType {
    OPENED,
    UPDATED,
    CLOSED,
    STOP_LOSS_TRIGGERED
}
