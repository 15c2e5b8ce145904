package com.tradingstation.exception;

import java.time.LocalDate;

/**
 * Thrown when a caller asks the market data provider for a date after the current
 * simulation time. This is a look-ahead bug in the caller and aborts a backtest run.
 */
public class TemporalViolationException extends BaseException {

    public TemporalViolationException(String symbol, LocalDate requested, LocalDate currentTime) {
        super(
                ErrorCode.TEMPORAL_VIOLATION,
                String.format(
                        "Cannot access data for %s at %s: current simulation time is %s",
                        symbol, requested, currentTime));
    }
}
