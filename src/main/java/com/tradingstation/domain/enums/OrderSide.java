package com.tradingstation.domain.enums;

/** Buy or sell side of an order. Long-only: a sell always closes (part of) an open position. */
public enum OrderSide {
    BUY,
    SELL;

    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
