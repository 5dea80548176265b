package com.autotrader.domain.enums;

/**
 * Lifecycle state of the trading cycle loop.
 *
 * <p>IDLE -> RUNNING on start, RUNNING -> IDLE on stop. HALTED is entered only when the
 * kill switch trips and stays until the kill switch is reset by an operator.
 */
public enum EngineState {
    IDLE,
    RUNNING,
    HALTED
}
