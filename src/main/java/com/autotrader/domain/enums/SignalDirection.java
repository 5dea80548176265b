package com.autotrader.domain.enums;

/** Directional opinion carried by a Signal. HOLD means "take no new action". */
public enum SignalDirection {
    BUY,
    SELL,
    HOLD
}
