package com.tradingstation.oms;

import com.tradingstation.account.AccountLedger;
import com.tradingstation.account.AccountLockManager;
import com.tradingstation.config.ExecutionProperties;
import com.tradingstation.domain.enums.LotSelection;
import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.enums.SellProceedsMode;
import com.tradingstation.domain.model.Account;
import com.tradingstation.domain.model.Position;
import com.tradingstation.exception.BaseException;
import com.tradingstation.exception.ErrorCode;
import com.tradingstation.exception.TemporalViolationException;
import com.tradingstation.marketdata.MarketDataProvider;
import com.tradingstation.pnl.CommissionModel;
import com.tradingstation.position.PositionBook;
import com.tradingstation.risk.RiskManager;
import com.tradingstation.risk.RiskValidationResult;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Executes market orders against the ledger and the position book.
 *
 * <p>Pipeline: load account, risk validation, price at the execution date's close,
 * commission, then the side-specific fill. The whole pipeline runs under the account's
 * lock, so a reservation and the position it pays for are never observed apart.
 *
 * <p>Business failures come back as failed {@link OrderResult}s with nothing mutated.
 * A {@link TemporalViolationException} is a caller bug and propagates; any other
 * unexpected exception is logged and reported as INTERNAL_ERROR.
 */
@Service
public class OrderExecutionService {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutionService.class);

    private static final String DEFAULT_EXIT_REASON = "User requested";

    private final AccountLedger accountLedger;
    private final PositionBook positionBook;
    private final RiskManager riskManager;
    private final CommissionModel commissionModel;
    private final AccountLockManager accountLockManager;
    private final ExecutionProperties executionProperties;

    public OrderExecutionService(
            AccountLedger accountLedger,
            PositionBook positionBook,
            RiskManager riskManager,
            CommissionModel commissionModel,
            AccountLockManager accountLockManager,
            ExecutionProperties executionProperties) {
        this.accountLedger = accountLedger;
        this.positionBook = positionBook;
        this.riskManager = riskManager;
        this.commissionModel = commissionModel;
        this.accountLockManager = accountLockManager;
        this.executionProperties = executionProperties;
    }

    public OrderResult executeOrder(OrderRequest order, MarketDataProvider marketData, LocalDate executionDate) {
        if (order.getAccountId() == null) {
            return OrderResult.failed(ErrorCode.NOT_FOUND, "Order has no account");
        }
        try {
            return accountLockManager.withLock(
                    order.getAccountId(), () -> execute(order, marketData, executionDate));
        } catch (TemporalViolationException e) {
            throw e;
        } catch (BaseException e) {
            log.warn(
                    "Order failed: {} {} x {}: {}",
                    order.getSide(),
                    order.getQuantity(),
                    order.getSymbol(),
                    e.getMessage());
            return OrderResult.failed(e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error(
                    "Order execution error: {} {} x {}", order.getSide(), order.getQuantity(), order.getSymbol(), e);
            return OrderResult.failed(ErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    private OrderResult execute(OrderRequest order, MarketDataProvider marketData, LocalDate executionDate) {
        Account account = accountLedger.getAccount(order.getAccountId());

        BigDecimal referencePrice = order.getReferencePrice() != null
                ? order.getReferencePrice()
                : marketData.getPrice(order.getSymbol(), executionDate).getClose();
        RiskValidationResult validation = riskManager.validateOrder(order, account, referencePrice);
        if (validation.isRejected()) {
            return OrderResult.failed(ErrorCode.VALIDATION_FAILED, validation.describeViolations());
        }

        BigDecimal executionPrice = marketData.getPrice(order.getSymbol(), executionDate).getClose();
        BigDecimal commission = commissionModel.calculate(order.getSide(), order.getQuantity(), executionPrice);

        return order.getSide() == OrderSide.BUY
                ? executeBuy(order, executionPrice, commission, executionDate)
                : executeSell(order, account, executionPrice, commission, executionDate);
    }

    // ==============================
    // BUY
    // ==============================

    private OrderResult executeBuy(
            OrderRequest order, BigDecimal executionPrice, BigDecimal commission, LocalDate executionDate) {
        BigDecimal totalCost =
                executionPrice.multiply(BigDecimal.valueOf(order.getQuantity())).add(commission);

        if (!accountLedger.reserveFunds(order.getAccountId(), totalCost)) {
            return OrderResult.failed(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    String.format(
                            "Insufficient funds. Required: %s, Available: %s",
                            totalCost, accountLedger.getAvailableBalance(order.getAccountId())));
        }

        Position position;
        try {
            position = positionBook.openPosition(
                    order.getAccountId(),
                    order.getSymbol(),
                    executionPrice,
                    order.getQuantity(),
                    executionDate,
                    order.getStopLoss());
        } catch (RuntimeException e) {
            accountLedger.releaseFunds(order.getAccountId(), totalCost);
            log.warn("Released {} on account {} after failed position open", totalCost, order.getAccountId());
            throw e;
        }

        log.info(
                "Buy executed: {} x {} @ {}, commission={}, position={}",
                order.getQuantity(),
                order.getSymbol(),
                executionPrice,
                commission,
                position.getId());

        return OrderResult.builder()
                .success(true)
                .side(OrderSide.BUY)
                .symbol(order.getSymbol())
                .quantity(order.getQuantity())
                .positionId(position.getId())
                .executionPrice(executionPrice)
                .commission(commission)
                .executionDate(executionDate)
                .build();
    }

    // ==============================
    // SELL
    // ==============================

    private OrderResult executeSell(
            OrderRequest order,
            Account account,
            BigDecimal executionPrice,
            BigDecimal commission,
            LocalDate executionDate) {
        Optional<Position> lot = selectLot(order);
        if (lot.isEmpty()) {
            return OrderResult.failed(ErrorCode.NO_OPEN_POSITION, "No open position for " + order.getSymbol());
        }

        Position position = lot.get();
        if (order.getQuantity() > position.getQuantity()) {
            return OrderResult.failed(
                    ErrorCode.INSUFFICIENT_QUANTITY,
                    String.format(
                            "Insufficient shares. Have %d, requested %d",
                            position.getQuantity(), order.getQuantity()));
        }

        BigDecimal grossProceeds = executionPrice.multiply(BigDecimal.valueOf(order.getQuantity()));
        BigDecimal proceeds = executionProperties.getSellProceeds() == SellProceedsMode.NET
                ? grossProceeds.subtract(commission)
                : grossProceeds;
        if (account.getCurrentCash().add(proceeds).signum() < 0) {
            return OrderResult.failed(
                    ErrorCode.INSUFFICIENT_FUNDS,
                    String.format("Sale proceeds %s do not cover commission %s", grossProceeds, commission));
        }

        String reason = order.getReason() != null ? order.getReason() : DEFAULT_EXIT_REASON;
        Position closed =
                positionBook.closePartial(position.getId(), order.getQuantity(), executionPrice, executionDate, reason);
        accountLedger.applyPnl(order.getAccountId(), proceeds);

        BigDecimal netPnl = closed.getRealizedPnl().subtract(commission);
        log.info(
                "Sell executed: {} x {} @ {}, realizedPnl={}, commission={}, netPnl={}",
                order.getQuantity(),
                order.getSymbol(),
                executionPrice,
                closed.getRealizedPnl(),
                commission,
                netPnl);

        return OrderResult.builder()
                .success(true)
                .side(OrderSide.SELL)
                .symbol(order.getSymbol())
                .quantity(order.getQuantity())
                .positionId(closed.getId())
                .executionPrice(executionPrice)
                .commission(commission)
                .executionDate(executionDate)
                .realizedPnl(closed.getRealizedPnl())
                .netPnl(netPnl)
                .build();
    }

    private Optional<Position> selectLot(OrderRequest order) {
        if (order.getPositionId() != null) {
            return positionBook.getOpenPositions(order.getAccountId()).stream()
                    .filter(p -> p.getId().equals(order.getPositionId()))
                    .filter(p -> Objects.equals(p.getSymbol(), order.getSymbol()))
                    .findFirst();
        }

        List<Position> candidates = positionBook.getOpenPositions(order.getAccountId()).stream()
                .filter(p -> Objects.equals(p.getSymbol(), order.getSymbol()))
                .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(
                executionProperties.getLotSelection() == LotSelection.LIFO
                        ? candidates.get(candidates.size() - 1)
                        : candidates.get(0));
    }
}
