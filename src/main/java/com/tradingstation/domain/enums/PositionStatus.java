package com.tradingstation.domain.enums;

/** Lifecycle of a position. Transitions only OPEN -> CLOSED. */
public enum PositionStatus {
    OPEN,
    CLOSED
}
