package com.tradingstation.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Stop-loss rule attached to a position at entry.
 *
 * <p>{@link Trailing} is accepted and stored but never triggers.
 */
public sealed interface StopLoss permits StopLoss.None, StopLoss.Price, StopLoss.Days, StopLoss.Trailing {

    static StopLoss none() {
        return None.INSTANCE;
    }

    static StopLoss price(BigDecimal threshold) {
        return new Price(threshold);
    }

    static StopLoss days(int daysToHold) {
        return new Days(daysToHold);
    }

    static StopLoss trailing(BigDecimal percent) {
        return new Trailing(percent);
    }

    record None() implements StopLoss {
        static final None INSTANCE = new None();
    }

    /** Exit when the close falls to or below {@code threshold}. */
    record Price(BigDecimal threshold) implements StopLoss {
        public Price {
            Objects.requireNonNull(threshold, "threshold");
            if (threshold.signum() <= 0) {
                throw new IllegalArgumentException("Stop-loss price threshold must be positive: " + threshold);
            }
        }
    }

    /** Exit once the position has been held for {@code daysToHold} whole days. */
    record Days(int daysToHold) implements StopLoss {
        public Days {
            if (daysToHold < 0) {
                throw new IllegalArgumentException("Stop-loss days must not be negative: " + daysToHold);
            }
        }
    }

    record Trailing(BigDecimal percent) implements StopLoss {}
}
