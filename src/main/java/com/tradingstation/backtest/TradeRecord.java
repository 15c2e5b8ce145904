package com.tradingstation.backtest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.oms.OrderResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** One executed fill in a backtest's trade log. */
@Value
@Builder
public class TradeRecord {

    LocalDate date;
    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal price;
    BigDecimal commission;
    Long positionId;

    /** Sells only. */
    BigDecimal realizedPnl;

    /** Sells only: why the position was exited (stop-loss rule or strategy reason). */
    String exitReason;

    static TradeRecord from(OrderResult result, String exitReason) {
        return TradeRecord.builder()
                .date(result.getExecutionDate())
                .symbol(result.getSymbol())
                .side(result.getSide())
                .quantity(result.getQuantity())
                .price(result.getExecutionPrice())
                .commission(result.getCommission())
                .positionId(result.getPositionId())
                .realizedPnl(result.getRealizedPnl())
                .exitReason(result.getSide() == OrderSide.SELL ? exitReason : null)
                .build();
    }

    @JsonIgnore
    public boolean isClosingTrade() {
        return side == OrderSide.SELL;
    }
}
