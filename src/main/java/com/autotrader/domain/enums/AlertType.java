package com.autotrader.domain.enums;

/** Category of an operator alert, used to route and label notifications. */
public enum AlertType {
    RISK,
    TRADE,
    POSITION,
    SYSTEM
}
