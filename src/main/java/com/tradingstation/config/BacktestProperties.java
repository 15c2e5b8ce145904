package com.tradingstation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Backtest settings. Properties prefix: {@code tradingstation.backtest.*}.
 *
 * <p>{@code lookbackDays} is how many calendar days of history before the start date are
 * loaded so indicators are warm on the first simulated day.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingstation.backtest")
public class BacktestProperties {

    private int lookbackDays = 100;
}
