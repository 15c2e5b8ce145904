package com.tradingstation.oms;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.model.StopLoss;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A market order submitted to the {@link OrderExecutionService}. Fills at the close of
 * the execution date.
 */
@Data
@Builder
public class OrderRequest {

    private Long accountId;
    private String symbol;
    private OrderSide side;
    private int quantity;

    /** Stop loss attached to the position a buy opens. Ignored for sells. */
    @Builder.Default
    private StopLoss stopLoss = StopLoss.none();

    /**
     * Price quoted by whoever created the order, used for pre-trade risk checks.
     * When null the coordinator quotes the market itself.
     */
    private BigDecimal referencePrice;

    /** Sells only: the exact position to sell. Null lets the lot-selection policy pick. */
    private Long positionId;

    /** Why the order was placed. Becomes the exit reason of the position a sell closes. */
    private String reason;
}
