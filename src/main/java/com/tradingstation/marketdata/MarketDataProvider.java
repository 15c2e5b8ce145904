package com.tradingstation.marketdata;

import com.tradingstation.domain.model.PriceBar;
import java.time.LocalDate;
import java.util.List;

/**
 * Time-aware view of daily market data.
 *
 * <p>Every read is bounded by {@link #getCurrentTime()}: no caller may observe a bar
 * dated after the current time. Backtests and live trading differ only in which
 * implementation supplies the clock.
 */
public interface MarketDataProvider {

    LocalDate getCurrentTime();

    /**
     * Returns the latest bar dated on or before {@code asOf}.
     *
     * @throws com.tradingstation.exception.TemporalViolationException if {@code asOf} is after the current time
     * @throws com.tradingstation.exception.DataNotFoundException if the symbol has no bar on or before {@code asOf}
     */
    PriceBar getPrice(String symbol, LocalDate asOf);

    /**
     * Returns bars within {@code [start, end]} in ascending date order. {@code end} is
     * clamped to the current time instead of failing.
     */
    List<PriceBar> getHistoricalPrices(String symbol, LocalDate start, LocalDate end);

    /** True iff {@link #getPrice(String, LocalDate)} would succeed for these arguments. */
    boolean isSymbolAvailable(String symbol, LocalDate asOf);
}
