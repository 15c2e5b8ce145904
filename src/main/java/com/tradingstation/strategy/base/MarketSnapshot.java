package com.tradingstation.strategy.base;

import com.tradingstation.marketdata.MarketDataProvider;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * What a strategy may see on a simulated day: the date and a market data view bounded
 * by that date. Strategies read prices only through {@link #getMarketData()}.
 */
@Value
@Builder
public class MarketSnapshot {

    LocalDate date;
    MarketDataProvider marketData;
}
