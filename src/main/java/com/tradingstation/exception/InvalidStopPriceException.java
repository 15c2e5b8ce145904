package com.tradingstation.exception;

import java.math.BigDecimal;

public class InvalidStopPriceException extends BaseException {

    public InvalidStopPriceException(BigDecimal entryPrice, BigDecimal stopPrice) {
        super(
                ErrorCode.INVALID_STOP_PRICE,
                String.format("Stop loss price %s must be below entry price %s", stopPrice, entryPrice));
    }
}
