package com.tradingstation.strategy;

import com.tradingstation.domain.enums.StrategyType;
import com.tradingstation.domain.model.StopLoss;
import com.tradingstation.strategy.impl.MovingAverageCrossoverStrategy;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds strategy instances from {@link StrategySettings}. Settings are bean-validated
 * first; strategies are plain objects, not Spring beans.
 *
 * <p>Adding a strategy type: implement {@link TradingStrategy}, add the tag to
 * {@link StrategyType}, and add a case in {@link #create(StrategySettings)}.
 */
@Component
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    private final Validator validator;

    public StrategyFactory(Validator validator) {
        this.validator = validator;
    }

    /**
     * @throws ConstraintViolationException if the settings are invalid
     * @throws IllegalArgumentException if the strategy type tag is unknown
     */
    public TradingStrategy create(StrategySettings settings) {
        Set<ConstraintViolation<StrategySettings>> violations = validator.validate(settings);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConstraintViolationException("Invalid strategy settings: " + details, violations);
        }

        StrategyType type = StrategyType.fromTag(settings.getStrategyType());
        StopLoss stopLoss = settings.getStopLoss() != null ? settings.getStopLoss().toStopLoss() : StopLoss.none();

        TradingStrategy strategy = switch (type) {
            case MA_CROSSOVER -> new MovingAverageCrossoverStrategy(
                    settings.getSymbols(),
                    settings.getShortPeriod(),
                    settings.getLongPeriod(),
                    settings.getPositionSize(),
                    stopLoss);
        };

        log.info("Created strategy: type={}, name={}, symbols={}", type, strategy.getName(), strategy.getSymbols());
        return strategy;
    }
}
