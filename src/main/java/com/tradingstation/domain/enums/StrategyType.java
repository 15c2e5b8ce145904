package com.tradingstation.domain.enums;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Strategy variants the {@link com.tradingstation.strategy.StrategyFactory} can build. */
@Getter
@RequiredArgsConstructor
public enum StrategyType {
    MA_CROSSOVER("ma_crossover");

    private final String tag;

    /** Resolves a configuration tag (case-insensitive), e.g. "ma_crossover". */
    public static StrategyType fromTag(String tag) {
        return Arrays.stream(values())
                .filter(t -> t.tag.equalsIgnoreCase(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown strategy type: " + tag));
    }
}
