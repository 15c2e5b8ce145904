package com.tradingstation.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One daily OHLCV bar for a symbol.
 *
 * <p>Indicator fields are pre-computed by the data import pipeline and are null when
 * the importer did not supply them. The engine itself only relies on {@code close}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBar {

    private String symbol;
    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal adjustedClose;
    private long volume;

    // Pre-computed indicators (nullable)
    private BigDecimal macd;
    private BigDecimal macdSignal;
    private BigDecimal macdHistogram;
    private BigDecimal sma50;
    private BigDecimal sma200;
    private BigDecimal volumeMa20;
    private BigDecimal rsi14;
}
