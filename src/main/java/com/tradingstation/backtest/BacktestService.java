package com.tradingstation.backtest;

import com.tradingstation.account.AccountLedger;
import com.tradingstation.domain.model.Account;
import com.tradingstation.event.EventPublisherHelper;
import com.tradingstation.strategy.StrategyFactory;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs backtests in the background on the {@code backtestExecutor} pool.
 *
 * <p>At most one run per account may be in flight, since runs on the same account would
 * interleave their cash and positions. Runs on different accounts proceed in parallel.
 * Every finished run publishes a {@link com.tradingstation.event.BacktestCompletedEvent}.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final BacktestRunner backtestRunner;
    private final AccountLedger accountLedger;
    private final StrategyFactory strategyFactory;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor backtestExecutor;

    /** Active runs by session id. */
    private final Map<String, BacktestHandle> sessions = new ConcurrentHashMap<>();

    /** Session id of the active run per account. */
    private final Map<Long, String> activeAccounts = new ConcurrentHashMap<>();

    public BacktestService(
            BacktestRunner backtestRunner,
            AccountLedger accountLedger,
            StrategyFactory strategyFactory,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("backtestExecutor") Executor backtestExecutor) {
        this.backtestRunner = backtestRunner;
        this.accountLedger = accountLedger;
        this.strategyFactory = strategyFactory;
        this.eventPublisherHelper = eventPublisherHelper;
        this.backtestExecutor = backtestExecutor;
    }

    /**
     * Resolves a request into a runnable configuration: the account must exist and its
     * initial capital becomes the run's capital; the strategy is built from its settings.
     *
     * @throws com.tradingstation.exception.ResourceNotFoundException if the account does not exist
     * @throws jakarta.validation.ConstraintViolationException if the strategy settings are invalid
     */
    public BacktestConfiguration toConfiguration(BacktestRequest request) {
        Account account = accountLedger.getAccount(request.getAccountId());
        return BacktestConfiguration.builder()
                .accountId(account.getId())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .initialCapital(account.getInitialCapital())
                .strategy(strategyFactory.create(request.getStrategy()))
                .build();
    }

    public BacktestHandle submit(BacktestRequest request) {
        return submit(toConfiguration(request));
    }

    /**
     * Submits a run and returns immediately.
     *
     * @throws IllegalStateException if the account already has a run in flight
     */
    public BacktestHandle submit(BacktestConfiguration config) {
        String sessionId = UUID.randomUUID().toString();
        String existing = activeAccounts.putIfAbsent(config.getAccountId(), sessionId);
        if (existing != null) {
            throw new IllegalStateException(
                    "Backtest already in progress for account " + config.getAccountId() + ": " + existing);
        }

        BacktestCancellation cancellation = new BacktestCancellation();
        CompletableFuture<BacktestResult> future = new CompletableFuture<>();
        BacktestHandle handle = new BacktestHandle(sessionId, config.getAccountId(), future, cancellation);
        sessions.put(sessionId, handle);

        log.info("Backtest submitted: session={}, account={}", sessionId, config.getAccountId());
        backtestExecutor.execute(() -> run(sessionId, config, cancellation, future));
        return handle;
    }

    /** Requests cancellation of a running session. Returns false if no such session is active. */
    public boolean cancel(String sessionId) {
        BacktestHandle handle = sessions.get(sessionId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("Backtest cancel requested: session={}", sessionId);
        return true;
    }

    public Optional<BacktestHandle> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public boolean isRunning(Long accountId) {
        return activeAccounts.containsKey(accountId);
    }

    private void run(
            String sessionId,
            BacktestConfiguration config,
            BacktestCancellation cancellation,
            CompletableFuture<BacktestResult> future) {
        BacktestResult result;
        try {
            result = backtestRunner.runBacktest(config, cancellation);
        } catch (RuntimeException e) {
            log.error("Backtest failed: session={}, account={}", sessionId, config.getAccountId(), e);
            release(sessionId, config.getAccountId());
            future.completeExceptionally(e);
            eventPublisherHelper.publishBacktestFailed(this, sessionId, e.getMessage());
            return;
        }
        release(sessionId, config.getAccountId());
        future.complete(result);
        eventPublisherHelper.publishBacktestFinished(this, sessionId, result);
    }

    private void release(String sessionId, Long accountId) {
        sessions.remove(sessionId);
        activeAccounts.remove(accountId, sessionId);
    }
}
