package com.tradingstation.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Machine-readable failure kinds shared by thrown exceptions and by failed
 * {@link com.tradingstation.oms.OrderResult}s.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    NOT_FOUND("NOT_FOUND", "Requested resource does not exist"),
    VALIDATION_FAILED("VALIDATION_FAILED", "Order rejected by risk validation"),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", "Not enough cash to reserve"),
    INSUFFICIENT_QUANTITY("INSUFFICIENT_QUANTITY", "Sell quantity exceeds quantity held"),
    NO_OPEN_POSITION("NO_OPEN_POSITION", "No open position for symbol"),
    INVALID_STOP_PRICE("INVALID_STOP_PRICE", "Stop price must be below entry price"),
    TEMPORAL_VIOLATION("TEMPORAL_VIOLATION", "Requested data lies after the current simulation time"),
    DATA_NOT_FOUND("DATA_NOT_FOUND", "No market data for symbol"),
    INTERNAL_ERROR("INTERNAL_ERROR", "Unexpected internal failure");

    private final String code;
    private final String description;
}
