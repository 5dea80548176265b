package com.autotrader.domain.enums;

/** OPEN positions are revalued every cycle; CLOSED positions are immutable. */
public enum PositionStatus {
    OPEN,
    CLOSED
}
