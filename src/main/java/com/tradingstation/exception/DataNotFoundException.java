package com.tradingstation.exception;

import java.time.LocalDate;

public class DataNotFoundException extends BaseException {

    public DataNotFoundException(String symbol) {
        super(ErrorCode.DATA_NOT_FOUND, "No data available for symbol " + symbol);
    }

    public DataNotFoundException(String symbol, LocalDate asOf) {
        super(ErrorCode.DATA_NOT_FOUND, String.format("No price data for %s on or before %s", symbol, asOf));
    }
}
