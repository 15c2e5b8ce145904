package com.tradingstation.strategy.impl;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.model.Position;
import com.tradingstation.domain.model.PriceBar;
import com.tradingstation.domain.model.StopLoss;
import com.tradingstation.strategy.TradingStrategy;
import com.tradingstation.strategy.base.MarketSnapshot;
import com.tradingstation.strategy.base.OrderIntent;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

/**
 * Long-only simple moving average crossover.
 *
 * <p>Per symbol and day, the short and long SMAs of the close are compared on the latest
 * bar and on the bar before it:
 * <ul>
 *   <li>BUY when short crosses from at-or-below long to above it, and no position is open
 *       for the symbol</li>
 *   <li>SELL when short crosses from at-or-above long to below it, and a position is open</li>
 * </ul>
 *
 * <p>History is read through the snapshot's market data, looking back {@code 2 * longPeriod}
 * calendar days. Symbols with fewer than {@code longPeriod + 1} bars are skipped, as are
 * days on which the symbol printed no new bar.
 */
public class MovingAverageCrossoverStrategy implements TradingStrategy {

    private static final Logger log = LoggerFactory.getLogger(MovingAverageCrossoverStrategy.class);

    private final List<String> symbols;
    private final int shortPeriod;
    private final int longPeriod;
    private final int positionSize;
    private final StopLoss stopLoss;

    public MovingAverageCrossoverStrategy(
            List<String> symbols, int shortPeriod, int longPeriod, int positionSize, StopLoss stopLoss) {
        if (shortPeriod <= 0 || longPeriod <= shortPeriod) {
            throw new IllegalArgumentException(String.format(
                    "Invalid MA periods: short=%d, long=%d (need 0 < short < long)", shortPeriod, longPeriod));
        }
        if (positionSize <= 0) {
            throw new IllegalArgumentException("Position size must be positive: " + positionSize);
        }
        this.symbols = List.copyOf(symbols);
        this.shortPeriod = shortPeriod;
        this.longPeriod = longPeriod;
        this.positionSize = positionSize;
        this.stopLoss = stopLoss != null ? stopLoss : StopLoss.none();
    }

    @Override
    public String getName() {
        return String.format("MA Crossover (%d/%d)", shortPeriod, longPeriod);
    }

    @Override
    public List<String> getSymbols() {
        return symbols;
    }

    @Override
    public List<OrderIntent> generateSignals(MarketSnapshot snapshot, List<Position> openPositions) {
        List<OrderIntent> intents = new ArrayList<>();
        LocalDate today = snapshot.getDate();

        for (String symbol : symbols) {
            List<PriceBar> history =
                    snapshot.getMarketData().getHistoricalPrices(symbol, today.minusDays(2L * longPeriod), today);

            if (history.size() < longPeriod + 1) {
                continue;
            }
            PriceBar latest = history.get(history.size() - 1);
            if (!latest.getDate().equals(today)) {
                continue;
            }

            BarSeries series = toBarSeries(symbol, history);
            ClosePriceIndicator close = new ClosePriceIndicator(series);
            SMAIndicator shortSma = new SMAIndicator(close, shortPeriod);
            SMAIndicator longSma = new SMAIndicator(close, longPeriod);

            int last = series.getEndIndex();
            Num shortNow = shortSma.getValue(last);
            Num longNow = longSma.getValue(last);
            Num shortPrev = shortSma.getValue(last - 1);
            Num longPrev = longSma.getValue(last - 1);

            boolean bullish = shortPrev.isLessThanOrEqual(longPrev) && shortNow.isGreaterThan(longNow);
            boolean bearish = shortPrev.isGreaterThanOrEqual(longPrev) && shortNow.isLessThan(longNow);
            boolean holding = openPositions.stream().anyMatch(p -> Objects.equals(p.getSymbol(), symbol));

            if (bullish && !holding) {
                intents.add(OrderIntent.builder()
                        .symbol(symbol)
                        .side(OrderSide.BUY)
                        .quantity(positionSize)
                        .stopLoss(stopLoss)
                        .referencePrice(latest.getClose())
                        .reason(String.format("MA%d crossed above MA%d", shortPeriod, longPeriod))
                        .build());
            } else if (bearish && holding) {
                intents.add(OrderIntent.builder()
                        .symbol(symbol)
                        .side(OrderSide.SELL)
                        .quantity(positionSize)
                        .referencePrice(latest.getClose())
                        .reason(String.format("MA%d crossed below MA%d", shortPeriod, longPeriod))
                        .build());
            }
        }

        if (!intents.isEmpty()) {
            log.debug("{} generated {} intents on {}", getName(), intents.size(), today);
        }
        return intents;
    }

    private static BarSeries toBarSeries(String symbol, List<PriceBar> history) {
        BarSeries series = new BaseBarSeriesBuilder().withName(symbol).build();
        for (PriceBar bar : history) {
            series.addBar(
                    bar.getDate().atStartOfDay(ZoneOffset.UTC),
                    bar.getOpen() != null ? bar.getOpen() : bar.getClose(),
                    bar.getHigh() != null ? bar.getHigh() : bar.getClose(),
                    bar.getLow() != null ? bar.getLow() : bar.getClose(),
                    bar.getClose(),
                    bar.getVolume());
        }
        return series;
    }
}
