package com.tradingstation.domain.enums;

/** Which open position a symbol-level sell closes when several are open for the same symbol. */
public enum LotSelection {

    /** Oldest open position first (insertion order). */
    FIFO,

    /** Most recently opened position first. */
    LIFO
}
