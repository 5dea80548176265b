package com.autotrader.core.engine;

/** How a single trading cycle ended. */
public enum CycleOutcome {

    /** Ran to the end; the loop sleeps for the poll interval. */
    COMPLETED,

    /** Aborted by an exception; the loop sleeps for the error backoff. */
    FAILED,

    /** The kill switch tripped; the loop stops. */
    HALTED
}
