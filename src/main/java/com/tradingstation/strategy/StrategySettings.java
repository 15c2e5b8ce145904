package com.tradingstation.strategy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Configuration surface for building a strategy through {@link StrategyFactory}.
 *
 * <p>Defaults: type {@code ma_crossover}, periods 20/50, 100 shares per trade, no stop loss.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategySettings {

    @NotBlank(message = "strategyType must not be blank")
    @Builder.Default
    private String strategyType = "ma_crossover";

    @NotEmpty(message = "symbols must not be empty")
    private List<String> symbols;

    @Positive(message = "shortPeriod must be positive")
    @Builder.Default
    private int shortPeriod = 20;

    @Positive(message = "longPeriod must be positive")
    @Builder.Default
    private int longPeriod = 50;

    @Positive(message = "positionSize must be positive")
    @Builder.Default
    private int positionSize = 100;

    @Valid
    private StopLossSettings stopLoss;

    @AssertTrue(message = "shortPeriod must be less than longPeriod")
    public boolean isShortPeriodBelowLongPeriod() {
        return shortPeriod < longPeriod;
    }
}
