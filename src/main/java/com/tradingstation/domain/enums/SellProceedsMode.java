package com.tradingstation.domain.enums;

/**
 * How the proceeds of a sell are posted to the account ledger.
 *
 * <ul>
 *   <li>NET: {@code price * quantity - commission}. Cash then reconciles with net P&L.</li>
 *   <li>GROSS: {@code price * quantity}. The sell commission is reported in the trade's
 *       net P&L but never debited from cash.</li>
 * </ul>
 */
public enum SellProceedsMode {
    NET,
    GROSS
}
