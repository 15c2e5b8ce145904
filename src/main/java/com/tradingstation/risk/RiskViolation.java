package com.tradingstation.risk;

import lombok.Builder;
import lombok.Getter;

/**
 * A single failed pre-trade check: machine-readable code such as
 * {@code POSITION_SIZE_EXCEEDED} plus a human-readable message.
 */
@Getter
@Builder
public class RiskViolation {

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
