package com.tradingstation.backtest;

import com.tradingstation.account.AccountLedger;
import com.tradingstation.config.BacktestProperties;
import com.tradingstation.domain.enums.BacktestStatus;
import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.model.Account;
import com.tradingstation.domain.model.Position;
import com.tradingstation.domain.model.PriceBar;
import com.tradingstation.marketdata.BacktestMarketDataProvider;
import com.tradingstation.oms.OrderExecutionService;
import com.tradingstation.oms.OrderRequest;
import com.tradingstation.oms.OrderResult;
import com.tradingstation.position.PositionBook;
import com.tradingstation.reporting.PerformanceMetrics;
import com.tradingstation.reporting.PerformanceMetricsCalculator;
import com.tradingstation.repository.HistoricalPriceRepository;
import com.tradingstation.risk.RiskManager;
import com.tradingstation.risk.StopLossEvaluation;
import com.tradingstation.strategy.TradingStrategy;
import com.tradingstation.strategy.base.MarketSnapshot;
import com.tradingstation.strategy.base.OrderIntent;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a strategy through every calendar day of a date range.
 *
 * <p>Each day, in order:
 * <ol>
 *   <li>advance the simulated clock</li>
 *   <li>sell open positions whose stop loss fires at today's close</li>
 *   <li>ask the strategy for intents and execute them in the order given</li>
 *   <li>mark open positions to market and record a daily snapshot</li>
 * </ol>
 *
 * <p>Rejected orders are recorded and the day continues. Any other failure aborts the
 * run. Cancellation is honoured only between days, so snapshots never describe a
 * half-processed day.
 */
@Service
public class BacktestRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final OrderExecutionService orderExecutionService;
    private final PositionBook positionBook;
    private final AccountLedger accountLedger;
    private final RiskManager riskManager;
    private final HistoricalPriceRepository historicalPriceRepository;
    private final PerformanceMetricsCalculator performanceMetricsCalculator;
    private final BacktestProperties backtestProperties;

    public BacktestRunner(
            OrderExecutionService orderExecutionService,
            PositionBook positionBook,
            AccountLedger accountLedger,
            RiskManager riskManager,
            HistoricalPriceRepository historicalPriceRepository,
            PerformanceMetricsCalculator performanceMetricsCalculator,
            BacktestProperties backtestProperties) {
        this.orderExecutionService = orderExecutionService;
        this.positionBook = positionBook;
        this.accountLedger = accountLedger;
        this.riskManager = riskManager;
        this.historicalPriceRepository = historicalPriceRepository;
        this.performanceMetricsCalculator = performanceMetricsCalculator;
        this.backtestProperties = backtestProperties;
    }

    public BacktestResult runBacktest(BacktestConfiguration config) {
        return runBacktest(config, BacktestCancellation.none());
    }

    /**
     * @throws com.tradingstation.exception.ResourceNotFoundException if the account does not exist
     * @throws IllegalArgumentException if the end date is before the start date
     * @throws IllegalStateException if the account holds open positions or its cash differs
     *         from the configured initial capital
     */
    public BacktestResult runBacktest(BacktestConfiguration config, BacktestCancellation cancellation) {
        if (config.getEndDate().isBefore(config.getStartDate())) {
            throw new IllegalArgumentException(String.format(
                    "Backtest end date %s is before start date %s", config.getEndDate(), config.getStartDate()));
        }
        requireFreshAccount(config);

        TradingStrategy strategy = config.getStrategy();
        log.info(
                "Starting backtest: account={}, {} to {}, strategy={}, symbols={}",
                config.getAccountId(),
                config.getStartDate(),
                config.getEndDate(),
                strategy.getName(),
                strategy.getSymbols());

        BacktestMarketDataProvider marketData = loadMarketData(config);
        List<TradeRecord> trades = new ArrayList<>();
        List<RejectedOrder> rejectedOrders = new ArrayList<>();
        List<DailySnapshot> snapshots = new ArrayList<>();
        BacktestStatus status = BacktestStatus.COMPLETED;

        for (LocalDate date = config.getStartDate(); !date.isAfter(config.getEndDate()); date = date.plusDays(1)) {
            if (cancellation.isCancelled()) {
                log.info("Backtest cancelled before {} after {} days", date, snapshots.size());
                status = BacktestStatus.CANCELLED;
                break;
            }
            try {
                marketData.advanceTime(date);
                processStopLosses(config, marketData, date, trades, rejectedOrders);
                processSignals(config, marketData, date, trades, rejectedOrders);
                snapshots.add(takeSnapshot(config.getAccountId(), marketData, date));
            } catch (RuntimeException e) {
                log.error("Backtest aborted on {}: {}", date, e.getMessage(), e);
                throw e;
            }
        }

        PerformanceMetrics metrics =
                performanceMetricsCalculator.calculate(config.getInitialCapital(), snapshots, trades);

        log.info(
                "Backtest {}: finalEquity={}, return={}, maxDD={}, sharpe={}, trades={}, rejected={}",
                status,
                metrics.getFinalEquity(),
                metrics.getTotalReturn(),
                metrics.getMaxDrawdown(),
                metrics.getSharpeRatio(),
                metrics.getTotalTrades(),
                rejectedOrders.size());

        return BacktestResult.builder()
                .accountId(config.getAccountId())
                .startDate(config.getStartDate())
                .endDate(config.getEndDate())
                .initialCapital(config.getInitialCapital())
                .finalEquity(metrics.getFinalEquity())
                .totalReturn(metrics.getTotalReturn())
                .maxDrawdown(metrics.getMaxDrawdown())
                .sharpeRatio(metrics.getSharpeRatio())
                .winRate(metrics.getWinRate())
                .totalTrades(metrics.getTotalTrades())
                .trades(List.copyOf(trades))
                .dailySnapshots(List.copyOf(snapshots))
                .status(status)
                .rejectedOrders(List.copyOf(rejectedOrders))
                .build();
    }

    // A run starts from the configured capital with nothing held
    private void requireFreshAccount(BacktestConfiguration config) {
        Account account = accountLedger.getAccount(config.getAccountId());
        int openPositions = positionBook.getOpenPositions(account.getId()).size();
        if (openPositions > 0 || account.getCurrentCash().compareTo(config.getInitialCapital()) != 0) {
            throw new IllegalStateException(String.format(
                    "Account %d is not fresh: cash %s, initial capital %s, %d open positions",
                    account.getId(),
                    account.getCurrentCash(),
                    config.getInitialCapital(),
                    openPositions));
        }
    }

    private BacktestMarketDataProvider loadMarketData(BacktestConfiguration config) {
        LocalDate from = config.getStartDate().minusDays(backtestProperties.getLookbackDays());
        Map<String, List<PriceBar>> history = new LinkedHashMap<>();
        for (String symbol : config.getStrategy().getSymbols()) {
            List<PriceBar> bars =
                    historicalPriceRepository.findBySymbolAndDateBetween(symbol, from, config.getEndDate());
            if (bars.isEmpty()) {
                log.warn("No price data for {} between {} and {}", symbol, from, config.getEndDate());
            }
            history.put(symbol, bars);
        }
        return new BacktestMarketDataProvider(history, config.getStartDate());
    }

    // ==============================
    // DAILY STEPS
    // ==============================

    private void processStopLosses(
            BacktestConfiguration config,
            BacktestMarketDataProvider marketData,
            LocalDate date,
            List<TradeRecord> trades,
            List<RejectedOrder> rejectedOrders) {
        for (Position position : positionBook.getOpenPositions(config.getAccountId())) {
            if (!marketData.isSymbolAvailable(position.getSymbol(), date)) {
                continue;
            }
            BigDecimal price = marketData.getPrice(position.getSymbol(), date).getClose();
            StopLossEvaluation evaluation = riskManager.evaluateStopLoss(position, price, date);
            if (!evaluation.isTriggered()) {
                continue;
            }

            log.info(
                    "Stop loss on position {} ({}): {}",
                    position.getId(),
                    position.getSymbol(),
                    evaluation.getReason());
            OrderRequest exit = OrderRequest.builder()
                    .accountId(config.getAccountId())
                    .symbol(position.getSymbol())
                    .side(OrderSide.SELL)
                    .quantity(position.getQuantity())
                    .positionId(position.getId())
                    .referencePrice(price)
                    .reason(evaluation.getReason())
                    .build();
            OrderResult result = orderExecutionService.executeOrder(exit, marketData, date);
            recordOutcome(exit, result, date, trades, rejectedOrders);
        }
    }

    private void processSignals(
            BacktestConfiguration config,
            BacktestMarketDataProvider marketData,
            LocalDate date,
            List<TradeRecord> trades,
            List<RejectedOrder> rejectedOrders) {
        MarketSnapshot snapshot = MarketSnapshot.builder().date(date).marketData(marketData).build();
        List<OrderIntent> intents = config.getStrategy()
                .generateSignals(snapshot, positionBook.getOpenPositions(config.getAccountId()));

        for (OrderIntent intent : intents) {
            OrderRequest order = OrderRequest.builder()
                    .accountId(config.getAccountId())
                    .symbol(intent.getSymbol())
                    .side(intent.getSide())
                    .quantity(intent.getQuantity())
                    .stopLoss(intent.getStopLoss())
                    .referencePrice(intent.getReferencePrice())
                    .reason(intent.getReason())
                    .build();
            OrderResult result = orderExecutionService.executeOrder(order, marketData, date);
            recordOutcome(order, result, date, trades, rejectedOrders);
        }
    }

    private void recordOutcome(
            OrderRequest order,
            OrderResult result,
            LocalDate date,
            List<TradeRecord> trades,
            List<RejectedOrder> rejectedOrders) {
        if (result.isSuccess()) {
            trades.add(TradeRecord.from(result, order.getReason()));
            return;
        }
        log.warn(
                "Order rejected on {}: {} {} x {}: {}",
                date,
                order.getSide(),
                order.getQuantity(),
                order.getSymbol(),
                result.getErrorMessage());
        rejectedOrders.add(RejectedOrder.builder()
                .date(date)
                .symbol(order.getSymbol())
                .side(order.getSide())
                .quantity(order.getQuantity())
                .errorCode(result.getErrorCode())
                .message(result.getErrorMessage())
                .build());
    }

    /** Open positions are valued at their latest close, or at entry price if the symbol has no bar yet. */
    private DailySnapshot takeSnapshot(Long accountId, BacktestMarketDataProvider marketData, LocalDate date) {
        Account account = accountLedger.getAccount(accountId);
        List<Position> openPositions = positionBook.getOpenPositions(accountId);

        BigDecimal positionsValue = BigDecimal.ZERO;
        for (Position position : openPositions) {
            BigDecimal mark = marketData.isSymbolAvailable(position.getSymbol(), date)
                    ? marketData.getPrice(position.getSymbol(), date).getClose()
                    : position.getEntryPrice();
            positionsValue = positionsValue.add(mark.multiply(BigDecimal.valueOf(position.getQuantity())));
        }

        return DailySnapshot.builder()
                .date(date)
                .cash(account.getCurrentCash())
                .positionsValue(positionsValue)
                .totalEquity(account.getCurrentCash().add(positionsValue))
                .openPositions(openPositions.size())
                .build();
    }
}
