package com.tradingstation.reporting;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerformanceMetrics {

    BigDecimal finalEquity;
    BigDecimal totalReturn;
    BigDecimal maxDrawdown;
    BigDecimal sharpeRatio;
    BigDecimal winRate;
    int totalTrades;
}
