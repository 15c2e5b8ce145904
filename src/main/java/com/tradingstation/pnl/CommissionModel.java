package com.tradingstation.pnl;

import com.tradingstation.domain.enums.OrderSide;
import java.math.BigDecimal;

/** Brokerage charged on a single fill. */
public interface CommissionModel {

    BigDecimal calculate(OrderSide side, int quantity, BigDecimal price);
}
