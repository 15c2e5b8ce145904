package com.tradingstation.domain.enums;

public enum BacktestStatus {
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
}
