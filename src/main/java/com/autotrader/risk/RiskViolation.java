package com.autotrader.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single failed risk rule: a machine-readable code and a human-readable message.
 */
@Getter
@Builder
public class RiskViolation {

    public static final String KILL_SWITCH_LOCKED = "KILL_SWITCH_LOCKED";
    public static final String DAILY_LOSS_LIMIT_REACHED = "DAILY_LOSS_LIMIT_REACHED";
    public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";

    private final String code;
    private final String message;

    public static RiskViolation of(String code, String message) {
        return RiskViolation.builder().code(code).message(message).build();
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
