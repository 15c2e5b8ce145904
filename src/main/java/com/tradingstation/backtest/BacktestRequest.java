package com.tradingstation.backtest;

import com.tradingstation.strategy.StrategySettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backtest parameters as supplied by a caller: the account to trade, the date range and
 * the strategy settings. Initial capital is taken from the account.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    @NotNull(message = "accountId is required")
    private Long accountId;

    @NotNull(message = "startDate is required")
    private LocalDate startDate;

    @NotNull(message = "endDate is required")
    private LocalDate endDate;

    @NotNull(message = "strategy is required")
    @Valid
    private StrategySettings strategy;
}
