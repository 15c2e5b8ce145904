package com.tradingstation.backtest;

import com.tradingstation.strategy.TradingStrategy;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Inputs of one backtest run. Start and end dates are inclusive. */
@Value
@Builder(toBuilder = true)
public class BacktestConfiguration {

    Long accountId;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal initialCapital;
    TradingStrategy strategy;
}
