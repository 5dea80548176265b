package com.autotrader.risk;

import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of the pre-trade gate: APPROVED (no violations) or REJECTED.
 *
 * <p>Rules are evaluated in precedence order and the governor stops at the first failure, so a
 * rejection carries exactly one violation today. A rejection is a value the engine logs, never an
 * exception.
 */
@Getter
public class RiskValidationResult {

    private final boolean approved;
    private final List<RiskViolation> violations;

    private RiskValidationResult(boolean approved, List<RiskViolation> violations) {
        this.approved = approved;
        this.violations = violations;
    }

    public static RiskValidationResult approved() {
        return new RiskValidationResult(true, Collections.emptyList());
    }

    public static RiskValidationResult rejected(RiskViolation violation) {
        return new RiskValidationResult(false, List.of(violation));
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }

    /** Message of the first violation, or null when approved. */
    public String getReason() {
        return violations.isEmpty() ? null : violations.get(0).getMessage();
    }

    /** Whether any violation carries the given code. */
    public boolean hasViolation(String code) {
        return violations.stream().anyMatch(v -> v.getCode().equals(code));
    }
}
