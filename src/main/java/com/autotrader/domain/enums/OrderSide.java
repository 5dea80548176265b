package com.autotrader.domain.enums;

/** Buy or sell side of an order. Maps to the exchange's unified side field. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. Used for exit and stop-loss orders. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }

    /** Lower-case wire value used by unified exchange clients ("buy" / "sell"). */
    public String wireValue() {
        return name().toLowerCase();
    }
}
