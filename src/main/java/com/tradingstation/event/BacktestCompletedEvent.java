package com.tradingstation.event;

import com.tradingstation.backtest.BacktestResult;
import com.tradingstation.domain.enums.BacktestStatus;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the backtest service when a submitted run finishes, whether it
 * completed, was cancelled or failed. {@code result} is null for FAILED runs.
 */
public class BacktestCompletedEvent extends ApplicationEvent {

    private final String sessionId;
    private final BacktestStatus status;
    private final BacktestResult result;
    private final String errorMessage;

    public BacktestCompletedEvent(
            Object source, String sessionId, BacktestStatus status, BacktestResult result, String errorMessage) {
        super(source);
        this.sessionId = sessionId;
        this.status = status;
        this.result = result;
        this.errorMessage = errorMessage;
    }

    public String getSessionId() {
        return sessionId;
    }

    public BacktestStatus getStatus() {
        return status;
    }

    public BacktestResult getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
