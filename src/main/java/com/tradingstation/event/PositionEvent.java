package com.tradingstation.event;

import com.tradingstation.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the position book whenever a position is opened, reduced or closed.
 *
 * <p>For REDUCED events {@link #getPosition()} is the closed slice that was sold, so
 * listeners always see the realized P&L of the shares that left the book.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
