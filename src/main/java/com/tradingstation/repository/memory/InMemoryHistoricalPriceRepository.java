package com.tradingstation.repository.memory;

import com.tradingstation.domain.model.PriceBar;
import com.tradingstation.repository.HistoricalPriceRepository;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Holds imported daily bars per symbol, one bar per date. A later import of the same
 * symbol and date replaces the earlier bar.
 */
@Repository
public class InMemoryHistoricalPriceRepository implements HistoricalPriceRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryHistoricalPriceRepository.class);

    private final Map<String, NavigableMap<LocalDate, PriceBar>> barsBySymbol = new ConcurrentHashMap<>();

    public void saveAll(Collection<PriceBar> bars) {
        for (PriceBar bar : bars) {
            barsBySymbol
                    .computeIfAbsent(bar.getSymbol(), s -> new ConcurrentSkipListMap<>())
                    .put(bar.getDate(), bar);
        }
        log.debug("Stored {} price bars", bars.size());
    }

    @Override
    public List<PriceBar> findBySymbolAndDateBetween(String symbol, LocalDate from, LocalDate to) {
        NavigableMap<LocalDate, PriceBar> bars = barsBySymbol.get(symbol);
        if (bars == null || from.isAfter(to)) {
            return List.of();
        }
        return List.copyOf(bars.subMap(from, true, to, true).values());
    }

    @Override
    public List<String> findAllSymbols() {
        return barsBySymbol.keySet().stream().sorted().toList();
    }
}
