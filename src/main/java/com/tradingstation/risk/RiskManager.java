package com.tradingstation.risk;

import com.tradingstation.domain.enums.OrderSide;
import com.tradingstation.domain.model.Account;
import com.tradingstation.domain.model.Position;
import com.tradingstation.domain.model.StopLoss;
import com.tradingstation.exception.InvalidStopPriceException;
import com.tradingstation.oms.OrderRequest;
import com.tradingstation.position.PositionBook;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-trade validation, stop-loss evaluation and risk-based position sizing.
 *
 * <p>Validation is pure: it reads the account and the open-position count, never
 * mutates anything, and reports every violation it finds.
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final RiskLimits riskLimits;
    private final PositionBook positionBook;

    public RiskManager(RiskLimits riskLimits, PositionBook positionBook) {
        this.riskLimits = riskLimits;
        this.positionBook = positionBook;
    }

    // ==============================
    // PRE-TRADE VALIDATION
    // ==============================

    /**
     * Validates an order against the account and the configured limits.
     *
     * @param referencePrice the quoted price used to estimate the order value
     */
    public RiskValidationResult validateOrder(OrderRequest order, Account account, BigDecimal referencePrice) {
        List<RiskViolation> violations = new ArrayList<>();

        if (!account.isActive()) {
            violations.add(RiskViolation.of("ACCOUNT_INACTIVE", "Account is not active"));
        }

        if (order.getQuantity() <= 0) {
            violations.add(RiskViolation.of("INVALID_QUANTITY", "Order quantity must be positive"));
        }

        if (order.getQuantity() > 0) {
            BigDecimal orderValue = referencePrice.multiply(BigDecimal.valueOf(order.getQuantity()));
            BigDecimal maxPositionValue = account.getInitialCapital().multiply(riskLimits.getMaxPositionFraction());
            if (orderValue.compareTo(maxPositionValue) > 0) {
                violations.add(RiskViolation.of(
                        "POSITION_SIZE_EXCEEDED",
                        String.format(
                                "Order value %s exceeds maximum position size %s", orderValue, maxPositionValue)));
            }
            if (order.getSide() == OrderSide.BUY) {
                checkBuyLimits(orderValue, account, violations);
            }
        }

        if (violations.isEmpty()) {
            return RiskValidationResult.approved();
        }

        log.warn(
                "Order rejected by risk validation: account={}, {} {} x {}, violations={}",
                account.getId(),
                order.getSide(),
                order.getQuantity(),
                order.getSymbol(),
                violations);
        return RiskValidationResult.rejected(violations);
    }

    private void checkBuyLimits(BigDecimal orderValue, Account account, List<RiskViolation> violations) {
        BigDecimal requiredCash = orderValue.add(riskLimits.getEstimatedCommission());
        if (requiredCash.compareTo(account.getAvailableCash()) > 0) {
            violations.add(RiskViolation.of(
                    "INSUFFICIENT_FUNDS",
                    String.format(
                            "Insufficient funds. Required: %s, Available: %s",
                            requiredCash, account.getAvailableCash())));
        }

        Integer maxOpenPositions = riskLimits.getMaxOpenPositions();
        if (maxOpenPositions != null) {
            int openPositions = positionBook.getOpenPositions(account.getId()).size();
            if (openPositions >= maxOpenPositions) {
                violations.add(RiskViolation.of(
                        "MAX_OPEN_POSITIONS_EXCEEDED",
                        String.format("%d positions already open, limit is %d", openPositions, maxOpenPositions)));
            }
        }
    }

    // ==============================
    // STOP LOSS
    // ==============================

    /**
     * Decides whether an open position's stop loss fires at {@code currentPrice} on
     * {@code currentDate}. Days held are whole calendar days since entry.
     */
    public StopLossEvaluation evaluateStopLoss(Position position, BigDecimal currentPrice, LocalDate currentDate) {
        StopLoss stopLoss = position.getStopLoss();

        if (stopLoss instanceof StopLoss.Price price) {
            if (currentPrice.compareTo(price.threshold()) <= 0) {
                return StopLossEvaluation.triggered(
                        String.format("Price stop loss triggered at %s", currentPrice), currentPrice);
            }
        } else if (stopLoss instanceof StopLoss.Days days) {
            long daysHeld = ChronoUnit.DAYS.between(position.getEntryDate(), currentDate);
            if (daysHeld >= days.daysToHold()) {
                return StopLossEvaluation.triggered(
                        String.format("Time stop loss triggered after %d days", daysHeld), currentPrice);
            }
        }
        // None and Trailing never fire
        return StopLossEvaluation.notTriggered();
    }

    // ==============================
    // POSITION SIZING
    // ==============================

    /**
     * Shares to buy so that hitting the stop loses {@code riskFraction} of the balance:
     * {@code floor(balance * riskFraction / (entryPrice - stopPrice))}.
     *
     * @throws InvalidStopPriceException if the stop is not below the entry price
     */
    public int calculatePositionSize(
            BigDecimal accountBalance, BigDecimal riskFraction, BigDecimal entryPrice, BigDecimal stopPrice) {
        if (stopPrice.compareTo(entryPrice) >= 0) {
            throw new InvalidStopPriceException(entryPrice, stopPrice);
        }

        BigDecimal riskAmount = accountBalance.multiply(riskFraction);
        BigDecimal riskPerShare = entryPrice.subtract(stopPrice);
        int shares = riskAmount.divide(riskPerShare, 0, RoundingMode.DOWN).intValue();

        log.debug(
                "Position size: balance={}, risk={}, riskAmount={}, riskPerShare={}, shares={}",
                accountBalance,
                riskFraction,
                riskAmount,
                riskPerShare,
                shares);
        return shares;
    }
}
