package com.tradingstation.strategy.base;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.model.StopLoss;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A strategy's request to trade, turned into an order by the backtest loop. */
@Value
@Builder
public class OrderIntent {

    String symbol;
    OrderSide side;
    int quantity;

    @Builder.Default
    StopLoss stopLoss = StopLoss.none();

    /** Close the strategy saw when deciding; used for risk estimation. */
    BigDecimal referencePrice;

    String reason;
}
