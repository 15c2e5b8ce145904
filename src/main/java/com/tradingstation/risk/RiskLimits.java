package com.tradingstation.risk;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pre-trade limits applied by {@link RiskManager}. A null {@code maxOpenPositions}
 * disables that check.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskLimits {

    /** Largest buy value allowed, as a fraction of the account's initial capital. */
    @Builder.Default
    private BigDecimal maxPositionFraction = new BigDecimal("0.25");

    /** Commission assumed when checking that a buy is affordable. */
    @Builder.Default
    private BigDecimal estimatedCommission = new BigDecimal("5.00");

    private Integer maxOpenPositions;
}
