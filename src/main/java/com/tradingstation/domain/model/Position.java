package com.tradingstation.domain.model;

import com.tradingstation.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * A long position held by an account.
 *
 * <p>Exit fields and {@code realizedPnl} are populated only once the status is CLOSED.
 * A closed record is final; the position book never replaces it again.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    Long id;
    Long accountId;
    String symbol;
    LocalDate entryDate;
    BigDecimal entryPrice;
    int quantity;

    @Builder.Default
    StopLoss stopLoss = StopLoss.none();

    @Builder.Default
    PositionStatus status = PositionStatus.OPEN;

    LocalDate exitDate;
    BigDecimal exitPrice;
    String exitReason;
    BigDecimal realizedPnl;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }
}
