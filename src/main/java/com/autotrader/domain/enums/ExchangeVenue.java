package com.autotrader.domain.enums;

/**
 * Exchange venues the live execution adapter knows how to talk to.
 * The venue decides the wire shape of stop-loss orders (see StopOrderMapper).
 */
public enum ExchangeVenue {
    OKX,
    BINANCE,
    BINANCE_US
}
