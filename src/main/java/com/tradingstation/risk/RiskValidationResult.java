package com.tradingstation.risk;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Outcome of pre-trade validation. Approved results carry no violations; rejected results
 * carry every violation found, not just the first.
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

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        return new RiskValidationResult(false, List.copyOf(violations));
    }

    public boolean isRejected() {
        return !approved;
    }

    /** Violation messages joined with "; ", empty when approved. */
    public String describeViolations() {
        return violations.stream().map(RiskViolation::getMessage).collect(Collectors.joining("; "));
    }
}
