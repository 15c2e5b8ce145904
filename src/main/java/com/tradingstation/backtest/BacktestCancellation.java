package com.tradingstation.backtest;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop flag. The backtest loop checks it between simulated days. */
public class BacktestCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static BacktestCancellation none() {
        return new BacktestCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
