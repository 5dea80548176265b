package com.autotrader.domain.enums;

/**
 * Execution mode for the engine.
 * LIVE sends real orders through the ExchangeClient. PAPER simulates fills at a reference price.
 */
public enum TradingMode {
    LIVE,
    PAPER
}
