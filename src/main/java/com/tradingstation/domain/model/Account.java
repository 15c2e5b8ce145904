package com.tradingstation.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A trading account. Immutable snapshot: the ledger replaces the stored record on every
 * cash movement, so callers never see a half-applied update.
 *
 * <p>{@code currentCash} is never negative. The whole cash balance is available for
 * reservation; there is no separate margin or hold bucket.
 */
@Value
@Builder(toBuilder = true)
public class Account {

    Long id;
    String name;
    BigDecimal initialCapital;
    BigDecimal currentCash;

    @Builder.Default
    boolean active = true;

    public BigDecimal getAvailableCash() {
        return currentCash;
    }
}
