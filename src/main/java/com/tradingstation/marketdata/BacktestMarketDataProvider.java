package com.tradingstation.marketdata;

import com.tradingstation.domain.model.PriceBar;
import com.tradingstation.exception.DataNotFoundException;
import com.tradingstation.exception.TemporalViolationException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Market data provider for backtests. Holds the preloaded history of every symbol and a
 * simulated clock that only moves forward.
 *
 * <p>The whole date range is loaded up front, so every read filters on the clock.
 * One instance serves one backtest run and is confined to the runner thread.
 */
public class BacktestMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(BacktestMarketDataProvider.class);

    private final Map<String, NavigableMap<LocalDate, PriceBar>> barsBySymbol = new TreeMap<>();
    private LocalDate currentTime;

    public BacktestMarketDataProvider(Map<String, ? extends Collection<PriceBar>> history, LocalDate startTime) {
        history.forEach((symbol, bars) -> {
            NavigableMap<LocalDate, PriceBar> byDate = new TreeMap<>();
            bars.forEach(bar -> byDate.put(bar.getDate(), bar));
            barsBySymbol.put(symbol, byDate);
        });
        this.currentTime = startTime;
        log.debug("Backtest market data loaded: {} symbols, clock at {}", barsBySymbol.size(), startTime);
    }

    @Override
    public LocalDate getCurrentTime() {
        return currentTime;
    }

    /**
     * Moves the simulated clock forward. Advancing to the current time is a no-op.
     *
     * @throws IllegalStateException if {@code newTime} is before the current time
     */
    public void advanceTime(LocalDate newTime) {
        if (newTime.isBefore(currentTime)) {
            throw new IllegalStateException(
                    String.format("Cannot move simulation time backwards from %s to %s", currentTime, newTime));
        }
        currentTime = newTime;
    }

    @Override
    public PriceBar getPrice(String symbol, LocalDate asOf) {
        if (asOf.isAfter(currentTime)) {
            throw new TemporalViolationException(symbol, asOf, currentTime);
        }
        NavigableMap<LocalDate, PriceBar> bars = barsBySymbol.get(symbol);
        if (bars == null) {
            throw new DataNotFoundException(symbol);
        }
        Map.Entry<LocalDate, PriceBar> latest = bars.floorEntry(asOf);
        if (latest == null) {
            throw new DataNotFoundException(symbol, asOf);
        }
        return latest.getValue();
    }

    @Override
    public List<PriceBar> getHistoricalPrices(String symbol, LocalDate start, LocalDate end) {
        NavigableMap<LocalDate, PriceBar> bars = barsBySymbol.get(symbol);
        LocalDate clampedEnd = end.isAfter(currentTime) ? currentTime : end;
        if (bars == null || start.isAfter(clampedEnd)) {
            return List.of();
        }
        return List.copyOf(bars.subMap(start, true, clampedEnd, true).values());
    }

    @Override
    public boolean isSymbolAvailable(String symbol, LocalDate asOf) {
        if (asOf.isAfter(currentTime)) {
            return false;
        }
        NavigableMap<LocalDate, PriceBar> bars = barsBySymbol.get(symbol);
        return bars != null && bars.floorKey(asOf) != null;
    }
}
