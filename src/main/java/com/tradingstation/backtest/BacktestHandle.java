package com.tradingstation.backtest;

import java.util.concurrent.CompletableFuture;
import lombok.Getter;

/** A backtest submitted to {@link BacktestService}. */
@Getter
public class BacktestHandle {

    private final String sessionId;
    private final Long accountId;
    private final CompletableFuture<BacktestResult> result;
    private final BacktestCancellation cancellation;

    BacktestHandle(
            String sessionId,
            Long accountId,
            CompletableFuture<BacktestResult> result,
            BacktestCancellation cancellation) {
        this.sessionId = sessionId;
        this.accountId = accountId;
        this.result = result;
        this.cancellation = cancellation;
    }

    /** Requests a stop at the next day boundary. The future then completes with a CANCELLED result. */
    public void cancel() {
        cancellation.cancel();
    }

    public boolean isDone() {
        return result.isDone();
    }
}
