package com.tradingstation.pnl;

import com.tradingstation.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code max(minimum, ratePerShare * quantity)}, rounded to cents.
 */
public class PerShareCommissionModel implements CommissionModel {

    private final BigDecimal ratePerShare;
    private final BigDecimal minimum;

    public PerShareCommissionModel(BigDecimal ratePerShare, BigDecimal minimum) {
        this.ratePerShare = ratePerShare;
        this.minimum = minimum != null ? minimum : BigDecimal.ZERO;
    }

    @Override
    public BigDecimal calculate(OrderSide side, int quantity, BigDecimal price) {
        BigDecimal fee = ratePerShare.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
        return fee.max(minimum);
    }
}
