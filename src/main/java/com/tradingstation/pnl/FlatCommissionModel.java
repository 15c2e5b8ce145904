package com.tradingstation.pnl;

import com.tradingstation.domain.enums.OrderSide;
import java.math.BigDecimal;

/** Same fee on every fill regardless of side, size or price. */
public class FlatCommissionModel implements CommissionModel {

    private final BigDecimal feePerOrder;

    public FlatCommissionModel(BigDecimal feePerOrder) {
        if (feePerOrder == null || feePerOrder.signum() < 0) {
            throw new IllegalArgumentException("Commission must be non-negative: " + feePerOrder);
        }
        this.feePerOrder = feePerOrder;
    }

    @Override
    public BigDecimal calculate(OrderSide side, int quantity, BigDecimal price) {
        return feePerOrder;
    }
}
