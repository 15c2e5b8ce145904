package com.tradingstation.position;

import com.tradingstation.account.AccountLockManager;
import com.tradingstation.domain.enums.PositionStatus;
import com.tradingstation.domain.model.Position;
import com.tradingstation.domain.model.StopLoss;
import com.tradingstation.event.EventPublisherHelper;
import com.tradingstation.exception.ResourceNotFoundException;
import com.tradingstation.repository.PositionRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks the lifecycle of long positions: open, partially sell, close.
 *
 * <p>Closing replaces the open record with an immutable closed record carrying the exit
 * price, date, reason and realized P&L {@code (exit - entry) * quantity}. A closed record
 * is never touched again; closing it a second time fails with not-found.
 *
 * <p>Mutations run under the owning account's lock from {@link AccountLockManager}.
 */
@Service
public class PositionBook {

    private static final Logger log = LoggerFactory.getLogger(PositionBook.class);

    private final PositionRepository positionRepository;
    private final AccountLockManager accountLockManager;
    private final EventPublisherHelper eventPublisherHelper;

    public PositionBook(
            PositionRepository positionRepository,
            AccountLockManager accountLockManager,
            EventPublisherHelper eventPublisherHelper) {
        this.positionRepository = positionRepository;
        this.accountLockManager = accountLockManager;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public Position openPosition(
            Long accountId,
            String symbol,
            BigDecimal entryPrice,
            int quantity,
            LocalDate entryDate,
            StopLoss stopLoss) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Position quantity must be positive: " + quantity);
        }
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw new IllegalArgumentException("Entry price must be positive: " + entryPrice);
        }

        Position opened = accountLockManager.withLock(accountId, () -> positionRepository.save(Position.builder()
                .accountId(accountId)
                .symbol(symbol)
                .entryPrice(entryPrice)
                .quantity(quantity)
                .entryDate(entryDate)
                .stopLoss(stopLoss != null ? stopLoss : StopLoss.none())
                .build()));

        log.info(
                "Position opened: id={}, account={}, {} x {} @ {} on {}",
                opened.getId(),
                accountId,
                quantity,
                symbol,
                entryPrice,
                entryDate);
        eventPublisherHelper.publishPositionOpened(this, opened);
        return opened;
    }

    /**
     * Closes the whole position.
     *
     * @throws ResourceNotFoundException if the position does not exist or is already closed
     */
    public Position closePosition(Long positionId, BigDecimal exitPrice, LocalDate exitDate, String reason) {
        Long accountId = getOpenPosition(positionId).getAccountId();

        Position closed = accountLockManager.withLock(accountId, () -> {
            Position open = getOpenPosition(positionId);
            return positionRepository.save(open.toBuilder()
                    .status(PositionStatus.CLOSED)
                    .exitPrice(exitPrice)
                    .exitDate(exitDate)
                    .exitReason(reason)
                    .realizedPnl(realizedPnl(open.getEntryPrice(), exitPrice, open.getQuantity()))
                    .build());
        });

        log.info(
                "Position closed: id={}, {} x {} @ {} -> {}, realizedPnl={}, reason={}",
                closed.getId(),
                closed.getQuantity(),
                closed.getSymbol(),
                closed.getEntryPrice(),
                exitPrice,
                closed.getRealizedPnl(),
                reason);
        eventPublisherHelper.publishPositionClosed(this, closed);
        return closed;
    }

    /**
     * Sells {@code quantity} shares of an open position. Selling everything is a plain
     * close. Otherwise the open position keeps its id with the remaining quantity and the
     * sold shares are recorded as a new closed position with their own realized P&L.
     *
     * @return the closed record covering the sold shares
     * @throws ResourceNotFoundException if the position does not exist or is already closed
     * @throws IllegalArgumentException if quantity is not in {@code [1, held]}
     */
    public Position closePartial(
            Long positionId, int quantity, BigDecimal exitPrice, LocalDate exitDate, String reason) {
        Position current = getOpenPosition(positionId);
        if (quantity <= 0 || quantity > current.getQuantity()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot sell %d shares of position %d holding %d", quantity, positionId, current.getQuantity()));
        }
        if (quantity == current.getQuantity()) {
            return closePosition(positionId, exitPrice, exitDate, reason);
        }

        Position soldSlice = accountLockManager.withLock(current.getAccountId(), () -> {
            Position open = getOpenPosition(positionId);
            positionRepository.save(
                    open.toBuilder().quantity(open.getQuantity() - quantity).build());
            return positionRepository.save(open.toBuilder()
                    .id(null)
                    .quantity(quantity)
                    .status(PositionStatus.CLOSED)
                    .exitPrice(exitPrice)
                    .exitDate(exitDate)
                    .exitReason(reason)
                    .realizedPnl(realizedPnl(open.getEntryPrice(), exitPrice, quantity))
                    .build());
        });

        log.info(
                "Position reduced: id={} sold {} x {} @ {} as closed slice {}, realizedPnl={}",
                positionId,
                quantity,
                soldSlice.getSymbol(),
                exitPrice,
                soldSlice.getId(),
                soldSlice.getRealizedPnl());
        eventPublisherHelper.publishPositionReduced(this, soldSlice);
        return soldSlice;
    }

    public Position getPosition(Long positionId) {
        return positionRepository
                .findById(positionId)
                .orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    }

    /** Open positions of the account, oldest first. */
    public List<Position> getOpenPositions(Long accountId) {
        return positionRepository.findByAccountIdAndStatus(accountId, PositionStatus.OPEN);
    }

    public List<Position> getClosedPositions(Long accountId) {
        return positionRepository.findByAccountIdAndStatus(accountId, PositionStatus.CLOSED);
    }

    /** {@code (currentPrice - entry) * quantity} for an open position, zero otherwise. */
    public BigDecimal calculateUnrealizedPnl(Position position, BigDecimal currentPrice) {
        if (!position.isOpen()) {
            return BigDecimal.ZERO;
        }
        return realizedPnl(position.getEntryPrice(), currentPrice, position.getQuantity());
    }

    private Position getOpenPosition(Long positionId) {
        return positionRepository
                .findById(positionId)
                .filter(Position::isOpen)
                .orElseThrow(() -> new ResourceNotFoundException("Open position", positionId));
    }

    private static BigDecimal realizedPnl(BigDecimal entryPrice, BigDecimal exitPrice, int quantity) {
        return exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(quantity));
    }
}
