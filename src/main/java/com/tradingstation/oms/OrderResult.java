package com.tradingstation.oms;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.exception.ErrorCode;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of {@link OrderExecutionService#executeOrder}. Failures are values: a failed
 * result carries an {@link ErrorCode} and message and guarantees no state was mutated.
 */
@Data
@Builder
public class OrderResult {

    private boolean success;

    private ErrorCode errorCode;
    private String errorMessage;

    private OrderSide side;
    private String symbol;
    private int quantity;

    /** Buys: the position opened. Sells: the closed record covering the sold shares. */
    private Long positionId;

    private BigDecimal executionPrice;
    private BigDecimal commission;
    private LocalDate executionDate;

    /** Sells only: {@code (exit - entry) * quantity} of the sold shares. */
    private BigDecimal realizedPnl;

    /** Sells only: realized P&L minus this order's commission. */
    private BigDecimal netPnl;

    public static OrderResult failed(ErrorCode errorCode, String errorMessage) {
        return OrderResult.builder()
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isFailed() {
        return !success;
    }
}
