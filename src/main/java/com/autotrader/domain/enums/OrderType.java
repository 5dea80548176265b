package com.autotrader.domain.enums;

/**
 * Order types placed by the execution adapters.
 * MARKET fills immediately; STOP_LOSS rests at the exchange until its trigger price is hit.
 */
public enum OrderType {
    MARKET,
    STOP_LOSS
}
