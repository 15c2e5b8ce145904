package com.tradingstation.config;

import com.tradingstation.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.properties.
 *
 * <p>Properties prefix: {@code tradingstation.risk.*}. {@code max-open-positions} is
 * unset by default, which disables that check.
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${tradingstation.risk.max-position-fraction:0.25}") BigDecimal maxPositionFraction,
            @Value("${tradingstation.risk.estimated-commission:5.00}") BigDecimal estimatedCommission,
            @Value("${tradingstation.risk.max-open-positions:#{null}}") Integer maxOpenPositions) {
        return RiskLimits.builder()
                .maxPositionFraction(maxPositionFraction)
                .estimatedCommission(estimatedCommission)
                .maxOpenPositions(maxOpenPositions)
                .build();
    }
}
