package com.tradingstation.strategy;

import com.tradingstation.domain.model.Position;
import com.tradingstation.strategy.base.MarketSnapshot;
import com.tradingstation.strategy.base.OrderIntent;
import java.util.List;

/**
 * Decides what to trade each simulated day.
 *
 * <p>Implementations must be deterministic: the same snapshot and open positions must
 * always produce the same intents in the same order.
 */
public interface TradingStrategy {

    String getName();

    /** Symbols the strategy trades; the backtest preloads history for these. */
    List<String> getSymbols();

    List<OrderIntent> generateSignals(MarketSnapshot snapshot, List<Position> openPositions);
}
