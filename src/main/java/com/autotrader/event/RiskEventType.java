package com.autotrader.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A proposed entry was rejected by the risk governor. */
    TRADE_REJECTED,

    /** Daily realized loss reached the configured limit; new entries are blocked until rollover. */
    DAILY_LOSS_LIMIT_BREACH,

    /** An open position fell to its stop-loss price and was closed. */
    STOP_LOSS_TRIGGERED,

    /** Cumulative loss reached the kill-switch threshold. Trading is locked until a manual reset. */
    KILL_SWITCH_TRIGGERED,

    /** The kill switch was reset by an operator. */
    KILL_SWITCH_RESET
}
