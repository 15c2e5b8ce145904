package com.tradingstation.risk;

import java.math.BigDecimal;
import lombok.Getter;

/** Whether a position's stop loss fired, and why. */
@Getter
public class StopLossEvaluation {

    private static final StopLossEvaluation NOT_TRIGGERED = new StopLossEvaluation(false, null, null);

    private final boolean triggered;
    private final String reason;
    private final BigDecimal triggerPrice;

    private StopLossEvaluation(boolean triggered, String reason, BigDecimal triggerPrice) {
        this.triggered = triggered;
        this.reason = reason;
        this.triggerPrice = triggerPrice;
    }

    public static StopLossEvaluation notTriggered() {
        return NOT_TRIGGERED;
    }

    public static StopLossEvaluation triggered(String reason, BigDecimal triggerPrice) {
        return new StopLossEvaluation(true, reason, triggerPrice);
    }
}
