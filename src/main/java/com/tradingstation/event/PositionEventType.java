package com.tradingstation.event;

/** Classifies the position change carried by a {@link PositionEvent}. */
public enum PositionEventType {

    /** A new position was opened by a buy fill. */
    OPENED,

    /** Part of an open position was sold; the position stays open with fewer shares. */
    REDUCED,

    /** The position was closed and its realized P&L is final. */
    CLOSED
}
