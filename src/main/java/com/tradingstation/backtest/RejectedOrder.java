package com.tradingstation.backtest;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.exception.ErrorCode;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** An order the coordinator refused during a backtest. The run carries on after it. */
@Value
@Builder
public class RejectedOrder {

    LocalDate date;
    String symbol;
    OrderSide side;
    int quantity;
    ErrorCode errorCode;
    String message;
}
