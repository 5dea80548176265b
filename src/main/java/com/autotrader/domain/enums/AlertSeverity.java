package com.autotrader.domain.enums;

/** Severity of an operator alert. CRITICAL alerts are reserved for kill-switch trips. */
public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
