package com.tradingstation.event;

import com.tradingstation.backtest.BacktestResult;
import com.tradingstation.domain.enums.BacktestStatus;
import com.tradingstation.domain.model.Position;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for the events
 * the engine emits. Delivery is synchronous unless a listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Position ----

    public void publishPositionOpened(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.OPENED));
    }

    public void publishPositionReduced(Object source, Position soldSlice) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, soldSlice, PositionEventType.REDUCED));
    }

    public void publishPositionClosed(Object source, Position position) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, PositionEventType.CLOSED));
    }

    // ---- Backtest ----

    public void publishBacktestFinished(Object source, String sessionId, BacktestResult result) {
        applicationEventPublisher.publishEvent(
                new BacktestCompletedEvent(source, sessionId, result.getStatus(), result, null));
    }

    public void publishBacktestFailed(Object source, String sessionId, String errorMessage) {
        applicationEventPublisher.publishEvent(
                new BacktestCompletedEvent(source, sessionId, BacktestStatus.FAILED, null, errorMessage));
    }
}
