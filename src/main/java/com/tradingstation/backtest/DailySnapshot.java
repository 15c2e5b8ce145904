package com.tradingstation.backtest;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** End-of-day account state. {@code totalEquity = cash + positionsValue}. */
@Value
@Builder
public class DailySnapshot {

    LocalDate date;
    BigDecimal cash;
    BigDecimal positionsValue;
    BigDecimal totalEquity;
    int openPositions;
}
