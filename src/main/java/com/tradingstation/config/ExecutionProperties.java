package com.tradingstation.config;

import com.tradingstation.domain.enums.LotSelection;
import com.tradingstation.domain.enums.SellProceedsMode;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Order execution settings. Properties prefix: {@code tradingstation.execution.*}.
 *
 * <p>With {@code commissionPerShare} unset every fill pays {@code flatCommission}.
 * When set, fills pay the per-share rate with {@code flatCommission} as the minimum.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradingstation.execution")
public class ExecutionProperties {

    private BigDecimal flatCommission = new BigDecimal("5.00");
    private BigDecimal commissionPerShare;
    private SellProceedsMode sellProceeds = SellProceedsMode.NET;
    private LotSelection lotSelection = LotSelection.FIFO;
}
