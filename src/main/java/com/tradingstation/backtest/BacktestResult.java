package com.tradingstation.backtest;

import com.tradingstation.domain.enums.BacktestStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Final report of a backtest run. Ratios ({@code totalReturn}, {@code maxDrawdown},
 * {@code winRate}) are fractions.
 *
 * <p>A CANCELLED result covers only the days simulated before cancellation.
 */
@Value
@Builder
public class BacktestResult {

    Long accountId;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal initialCapital;
    BigDecimal finalEquity;
    BigDecimal totalReturn;
    BigDecimal maxDrawdown;
    BigDecimal sharpeRatio;
    BigDecimal winRate;
    int totalTrades;
    List<TradeRecord> trades;
    List<DailySnapshot> dailySnapshots;

    BacktestStatus status;
    List<RejectedOrder> rejectedOrders;
}
