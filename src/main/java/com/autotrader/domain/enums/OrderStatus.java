package com.autotrader.domain.enums;

/**
 * Lifecycle status of an order as reported back by an execution adapter.
 * OPEN is used for resting stop-loss orders; market orders come back FILLED.
 */
public enum OrderStatus {
    OPEN,
    FILLED,
    PARTIALLY_FILLED,
    CANCELLED,
    REJECTED;

    /** Maps a unified exchange status string ("closed", "open", "canceled", ...) to an OrderStatus. */
    public static OrderStatus fromExchange(String status) {
        if (status == null) {
            return OPEN;
        }
        return switch (status.toLowerCase()) {
            case "closed", "filled" -> FILLED;
            case "partially_filled", "partial" -> PARTIALLY_FILLED;
            case "canceled", "cancelled", "expired" -> CANCELLED;
            case "rejected" -> REJECTED;
            default -> OPEN;
        };
    }
}
