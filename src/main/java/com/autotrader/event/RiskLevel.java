package com.autotrader.event;

/**
 * Severity of a {@link RiskEvent}. CRITICAL is reserved for conditions that trigger automatic
 * protective action (kill switch).
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
