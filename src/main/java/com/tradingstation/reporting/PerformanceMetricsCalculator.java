package com.tradingstation.reporting;

import com.tradingstation.backtest.DailySnapshot;
import com.tradingstation.backtest.TradeRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Computes backtest statistics from the equity curve and the trade log.
 *
 * <ul>
 *   <li>Total return: {@code (finalEquity - initialCapital) / initialCapital}</li>
 *   <li>Max drawdown: largest {@code (peak - equity) / peak}, peak seeded with the initial capital</li>
 *   <li>Sharpe: mean daily return over its population standard deviation, annualized by
 *       {@code sqrt(252)}; zero when the deviation is zero</li>
 *   <li>Win rate: share of closing trades with positive realized P&L</li>
 * </ul>
 *
 * <p>All ratios are fractions rounded to {@value #SCALE} decimal places.
 */
@Service
public class PerformanceMetricsCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMetricsCalculator.class);

    static final int SCALE = 6;
    private static final double TRADING_DAYS_PER_YEAR = 252.0;

    public PerformanceMetrics calculate(
            BigDecimal initialCapital, List<DailySnapshot> snapshots, List<TradeRecord> trades) {
        BigDecimal finalEquity = snapshots.isEmpty()
                ? initialCapital
                : snapshots.get(snapshots.size() - 1).getTotalEquity();

        BigDecimal totalReturn =
                finalEquity.subtract(initialCapital).divide(initialCapital, SCALE, RoundingMode.HALF_UP);

        List<TradeRecord> closingTrades =
                trades.stream().filter(TradeRecord::isClosingTrade).toList();

        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .finalEquity(finalEquity)
                .totalReturn(totalReturn)
                .maxDrawdown(calculateMaxDrawdown(initialCapital, snapshots))
                .sharpeRatio(calculateSharpeRatio(snapshots))
                .winRate(calculateWinRate(closingTrades))
                .totalTrades(closingTrades.size())
                .build();

        log.debug(
                "Metrics: finalEquity={}, return={}, maxDD={}, sharpe={}, winRate={}, trades={}",
                metrics.getFinalEquity(),
                metrics.getTotalReturn(),
                metrics.getMaxDrawdown(),
                metrics.getSharpeRatio(),
                metrics.getWinRate(),
                metrics.getTotalTrades());
        return metrics;
    }

    BigDecimal calculateMaxDrawdown(BigDecimal initialCapital, List<DailySnapshot> snapshots) {
        BigDecimal peak = initialCapital;
        BigDecimal maxDrawdown = BigDecimal.ZERO;

        for (DailySnapshot snapshot : snapshots) {
            BigDecimal equity = snapshot.getTotalEquity();
            if (equity.compareTo(peak) > 0) {
                peak = equity;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = peak.subtract(equity).divide(peak, SCALE, RoundingMode.HALF_UP);
                if (drawdown.compareTo(maxDrawdown) > 0) {
                    maxDrawdown = drawdown;
                }
            }
        }
        return maxDrawdown;
    }

    BigDecimal calculateSharpeRatio(List<DailySnapshot> snapshots) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            double previous = snapshots.get(i - 1).getTotalEquity().doubleValue();
            if (previous == 0) {
                continue;
            }
            double current = snapshots.get(i).getTotalEquity().doubleValue();
            returns.add((current - previous) / previous);
        }
        if (returns.isEmpty()) {
            return BigDecimal.ZERO;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = returns.stream()
                .mapToDouble(r -> (r - mean) * (r - mean))
                .average()
                .orElse(0);
        double stdDev = Math.sqrt(variance);

        if (stdDev == 0) {
            return BigDecimal.ZERO;
        }
        double sharpe = mean / stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR);
        return BigDecimal.valueOf(sharpe).setScale(SCALE, RoundingMode.HALF_UP);
    }

    BigDecimal calculateWinRate(List<TradeRecord> closingTrades) {
        if (closingTrades.isEmpty()) {
            return BigDecimal.ZERO;
        }
        long winners = closingTrades.stream()
                .filter(t -> t.getRealizedPnl() != null && t.getRealizedPnl().signum() > 0)
                .count();
        return BigDecimal.valueOf(winners)
                .divide(BigDecimal.valueOf(closingTrades.size()), SCALE, RoundingMode.HALF_UP);
    }
}
