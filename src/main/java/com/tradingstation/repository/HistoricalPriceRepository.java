package com.tradingstation.repository;

import com.tradingstation.domain.model.PriceBar;
import java.time.LocalDate;
import java.util.List;

/** Read port for imported daily price history. */
public interface HistoricalPriceRepository {

    /** Bars for {@code symbol} dated within {@code [from, to]}, ascending by date. */
    List<PriceBar> findBySymbolAndDateBetween(String symbol, LocalDate from, LocalDate to);

    /** All known symbols, sorted. */
    List<String> findAllSymbols();
}
