package com.tradingstation.strategy;

import com.tradingstation.domain.model.StopLoss;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Stop-loss template for positions a strategy opens: a price threshold or a holding period, never both. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopLossSettings {

    @Positive(message = "priceThreshold must be positive")
    private BigDecimal priceThreshold;

    @PositiveOrZero(message = "daysToHold must not be negative")
    private Integer daysToHold;

    @AssertTrue(message = "exactly one of priceThreshold or daysToHold must be set")
    public boolean isExactlyOneRuleSet() {
        return (priceThreshold != null) ^ (daysToHold != null);
    }

    public StopLoss toStopLoss() {
        return priceThreshold != null ? StopLoss.price(priceThreshold) : StopLoss.days(daysToHold);
    }
}
